package work.arachne.config.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One operation of a transaction against a {@link ConfigGraph}.
 *
 * <p>Entity positions accept an {@link EntityRef}, a {@link TempId} or a {@link LookupRef}.
 * Attribute values that are tempids or lookup refs are resolved to entity refs when applied.
 */
public sealed interface TxOp permits TxOp.EntityMap, TxOp.Add, TxOp.Retract, TxOp.RetractEntity {

    /**
     * Asserts every attribute of the map on one entity; without an id a new entity is created.
     */
    record EntityMap(Object id, Map<String, Object> attributes) implements TxOp {
        public EntityMap {
            attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public static EntityMap of(Map<String, Object> attributes) {
            return new EntityMap(null, attributes);
        }

        public static EntityMap withTempId(String tempId, Map<String, Object> attributes) {
            return new EntityMap(TempId.of(tempId), attributes);
        }
    }

    record Add(Object entity, String attribute, Object value) implements TxOp {
        public Add {
            Objects.requireNonNull(entity, "entity");
            Objects.requireNonNull(attribute, "attribute");
        }
    }

    record Retract(Object entity, String attribute) implements TxOp {
        public Retract {
            Objects.requireNonNull(entity, "entity");
            Objects.requireNonNull(attribute, "attribute");
        }
    }

    record RetractEntity(Object entity) implements TxOp {
        public RetractEntity {
            Objects.requireNonNull(entity, "entity");
        }
    }
}
