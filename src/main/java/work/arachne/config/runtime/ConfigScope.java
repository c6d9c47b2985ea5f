package work.arachne.config.runtime;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;
import work.arachne.config.dsl.Provenance;
import work.arachne.config.error.ScopeException;
import work.arachne.config.error.UnresolvedReferenceException;
import work.arachne.config.store.ConfigGraph;
import work.arachne.config.store.EntityRef;
import work.arachne.config.store.EntityStore;
import work.arachne.config.store.LookupRef;
import work.arachne.config.store.TempId;
import work.arachne.config.store.TxOp;

/**
 * The configuration currently being built, visible to every DSL form evaluated on the same thread
 * for the dynamic extent of {@link #withScope}. Scopes nest: an inner scope hides the outer one until
 * it exits. Each build gets its own scope instance; nothing is shared between threads.
 */
public final class ConfigScope {
    private static final ThreadLocal<ConfigScope> ACTIVE = new ThreadLocal<>();

    private final EntityStore store;
    private ConfigGraph graph;

    private ConfigScope(EntityStore store, ConfigGraph graph) {
        this.store = Objects.requireNonNull(store, "store");
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Runs {@code body} with a fresh scope bound to {@code initial}. The scope is unbound on every
     * exit path; the previously active scope, if any, is restored.
     */
    public static <T> ScopeResult<T> withScope(EntityStore store, ConfigGraph initial, ScopeBody<T> body) throws Exception {
        ConfigScope previous = ACTIVE.get();
        ConfigScope scope = new ConfigScope(store, initial);
        ACTIVE.set(scope);
        try {
            T value = body.run();
            return new ScopeResult<>(value, scope.graph);
        } finally {
            if (previous == null) {
                ACTIVE.remove();
            } else {
                ACTIVE.set(previous);
            }
        }
    }

    public static boolean isActive() {
        return ACTIVE.get() != null;
    }

    private static ConfigScope active() {
        ConfigScope scope = ACTIVE.get();
        if (scope == null) {
            throw new ScopeException();
        }
        return scope;
    }

    /**
     * Return the config value currently in context.
     */
    public static ConfigGraph currentGraph() {
        return active().graph;
    }

    public static EntityStore store() {
        return active().store;
    }

    /**
     * Replaces the config in context with {@code fn} applied to it and returns the new value.
     */
    public static ConfigGraph update(UnaryOperator<ConfigGraph> fn) {
        ConfigScope scope = active();
        ConfigGraph next = fn.apply(scope.graph);
        if (next == null) {
            throw new IllegalStateException("config update function returned null");
        }
        scope.graph = next;
        return next;
    }

    public static <A> ConfigGraph update(BiFunction<ConfigGraph, A, ConfigGraph> fn, A arg) {
        return update(graph -> fn.apply(graph, arg));
    }

    /**
     * Like {@link #update(BiFunction, Object)} for functions taking any number of extra arguments,
     * which are handed over in call order.
     */
    public static ConfigGraph updateWith(BiFunction<ConfigGraph, List<Object>, ConfigGraph> fn, Object... args) {
        List<Object> extra = args == null ? List.of() : Collections.unmodifiableList(Arrays.asList(args));
        return update(graph -> fn.apply(graph, extra));
    }

    public static ConfigGraph transact(List<TxOp> ops) {
        EntityStore store = active().store;
        return update(store::apply, ops);
    }

    /**
     * Applies {@code ops} to the config in context and resolves {@code tempId} against the resulting
     * graph.
     */
    public static Optional<EntityRef> transact(List<TxOp> ops, TempId tempId) {
        EntityStore store = active().store;
        ConfigGraph next = update(store::apply, ops);
        if (tempId == null) {
            return Optional.empty();
        }
        return store.resolveTempId(next, tempId);
    }

    /**
     * Return the ref of the entity with the given Arachne ID in the config in context.
     *
     * @throws UnresolvedReferenceException if no such entity exists yet
     */
    public static EntityRef resolveId(String aid) {
        ConfigScope scope = active();
        ConfigGraph graph = scope.graph;
        String dslFunction = Provenance.currentFunctionName().orElse("<unknown>");
        return scope.store.attr(graph, LookupRef.aid(aid), ConfigGraph.DB_ID)
            .filter(EntityRef.class::isInstance)
            .map(EntityRef.class::cast)
            .orElseThrow(() -> new UnresolvedReferenceException(graph, aid, dslFunction));
    }

    public static Optional<Object> attr(Object entity, String attribute) {
        ConfigScope scope = active();
        return scope.store.attr(scope.graph, entity, attribute);
    }
}
