package work.arachne.config.store;

import java.util.List;
import java.util.Optional;

/**
 * Narrow contract of the configuration store consumed by the script engine. Implementations are
 * pure: applying the same ops to the same graph always yields an equal graph.
 */
public interface EntityStore {
    ConfigGraph empty();

    ConfigGraph apply(ConfigGraph graph, List<TxOp> ops);

    Optional<EntityRef> resolveTempId(ConfigGraph graph, TempId tempId);

    /**
     * Reads {@code attribute} of the entity designated by {@code entity} (an {@link EntityRef} or a
     * {@link LookupRef}). The pseudo attribute {@link ConfigGraph#DB_ID} yields the entity ref itself.
     */
    Optional<Object> attr(ConfigGraph graph, Object entity, String attribute);
}
