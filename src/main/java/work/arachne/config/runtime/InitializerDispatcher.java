package work.arachne.config.runtime;

import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.arachne.config.module.ModuleLoader;
import work.arachne.config.store.ConfigGraph;
import work.arachne.config.store.EntityStore;
import work.arachne.config.tooling.ScriptRuntime;

/**
 * Applies one {@link Initializer} to a graph. A fresh {@link ConfigScope} bound to the input graph
 * is active while the initializer runs; the graph it holds afterwards is the result. A failing
 * initializer has no effect: the exception propagates and the input graph is left as it was.
 */
public final class InitializerDispatcher {
    private static final Logger log = LoggerFactory.getLogger(InitializerDispatcher.class);

    private final EntityStore store;
    private final FunctionResolver functions;
    private final ModuleLoader modules;
    private final ScriptRuntime scripts;

    public InitializerDispatcher(EntityStore store, FunctionResolver functions, ModuleLoader modules, ScriptRuntime scripts) {
        this.store = Objects.requireNonNull(store, "store");
        this.functions = Objects.requireNonNull(functions, "functions");
        this.modules = Objects.requireNonNull(modules, "modules");
        this.scripts = Objects.requireNonNull(scripts, "scripts");
    }

    public ConfigGraph apply(ConfigGraph graph, Initializer initializer) throws Exception {
        Objects.requireNonNull(graph, "graph");
        String description = initializer == null ? "<none>" : initializer.describe();
        long started = System.nanoTime();
        log.atDebug().addKeyValue("initializer", description).log("Applying initializer");
        ScopeResult<Void> result = ConfigScope.withScope(store, graph, () -> {
            dispatch(initializer);
            return null;
        });
        log.atDebug()
            .addKeyValue("initializer", description)
            .addKeyValue("entities", result.graph().size())
            .addKeyValue("elapsedMs", (System.nanoTime() - started) / 1_000_000)
            .log("Initializer applied");
        return result.graph();
    }

    private void dispatch(Initializer initializer) throws Exception {
        if (initializer == null) {
            return;
        }
        if (initializer instanceof Initializer.NamedFunction fn) {
            UnaryOperator<ConfigGraph> function = functions.resolve(fn.reference());
            ConfigScope.update(function);
        } else if (initializer instanceof Initializer.ModuleReference module) {
            modules.load(module.moduleId());
        } else if (initializer instanceof Initializer.ScriptFile file) {
            modules.unloadConfigModules();
            scripts.evaluateFile(file.path(), modules::require);
        } else if (initializer instanceof Initializer.OpsBatch batch) {
            ConfigScope.transact(batch.ops());
        } else if (initializer instanceof Initializer.InlineScript script) {
            if (script.isEmpty()) {
                return;
            }
            modules.unloadConfigModules();
            scripts.evaluate(script.source(), "inline", "inline script", modules::require);
        } else {
            throw new IllegalStateException("Unsupported initializer " + initializer);
        }
    }
}
