package work.arachne.config.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.arachne.config.error.InvalidTransactionException;

/**
 * Converts raw transaction data (as read from JSON/YAML or handed over by a script) into {@link TxOp}s.
 *
 * <ul>
 *   <li>a map is an entity map; its {@code db/id} entry, if any, names the entity</li>
 *   <li>{@code ["db/add", e, a, v]}, {@code ["db/retract", e, a]}, {@code ["db/retractEntity", e]}</li>
 *   <li>{@code ["create-entity", {...}]} is an entity map</li>
 * </ul>
 *
 * In entity position a string is a tempid, a number an entity ref and a two element list
 * {@code [attribute, value]} a lookup ref. As an attribute value, {@code {"tempid": "x"}} denotes a
 * tempid and {@code {"lookup": [attribute, value]}} a lookup ref.
 */
public final class TxData {
    private TxData() {}

    public static List<TxOp> parse(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new InvalidTransactionException("transaction data must be a list", raw);
        }
        List<TxOp> ops = new ArrayList<>(list.size());
        for (Object entry : list) {
            ops.add(parseOp(entry));
        }
        return ops;
    }

    private static TxOp parseOp(Object entry) {
        if (entry instanceof TxOp op) {
            return op;
        }
        if (entry instanceof Map<?, ?> map) {
            return entityMap(map, entry);
        }
        if (entry instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof String kind) {
            switch (kind) {
                case "db/add":
                    requireArity(list, 4, entry);
                    return new TxOp.Add(entityId(list.get(1), entry), attribute(list.get(2), entry), value(list.get(3)));
                case "db/retract":
                    requireArity(list, 3, entry);
                    return new TxOp.Retract(entityId(list.get(1), entry), attribute(list.get(2), entry));
                case "db/retractEntity":
                    requireArity(list, 2, entry);
                    return new TxOp.RetractEntity(entityId(list.get(1), entry));
                case "create-entity":
                    requireArity(list, 2, entry);
                    if (list.get(1) instanceof Map<?, ?> attrs) {
                        return entityMap(attrs, entry);
                    }
                    throw new InvalidTransactionException("create-entity expects a map of attributes", entry);
                default:
                    throw new InvalidTransactionException("unknown operation " + kind, entry);
            }
        }
        throw new InvalidTransactionException("unrecognised transaction entry", entry);
    }

    private static TxOp.EntityMap entityMap(Map<?, ?> map, Object entry) {
        Object id = null;
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (var e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (ConfigGraph.DB_ID.equals(key)) {
                id = entityId(e.getValue(), entry);
            } else {
                attributes.put(key, value(e.getValue()));
            }
        }
        return new TxOp.EntityMap(id, attributes);
    }

    private static Object entityId(Object raw, Object entry) {
        if (raw instanceof EntityRef || raw instanceof TempId || raw instanceof LookupRef) {
            return raw;
        }
        if (raw instanceof String name) {
            return TempId.of(name);
        }
        if (raw instanceof Number number) {
            return new EntityRef(number.longValue());
        }
        if (raw instanceof List<?> pair && pair.size() == 2 && pair.get(0) instanceof String attr) {
            return new LookupRef(attr, pair.get(1));
        }
        if (raw instanceof Map<?, ?> map) {
            Object special = value(map);
            if (special instanceof TempId || special instanceof LookupRef) {
                return special;
            }
        }
        throw new InvalidTransactionException("cannot use " + raw + " as an entity id", entry);
    }

    private static Object value(Object raw) {
        if (raw instanceof Map<?, ?> map && map.size() == 1) {
            Object tempid = map.get("tempid");
            if (tempid instanceof String name) {
                return TempId.of(name);
            }
            Object lookup = map.get("lookup");
            if (lookup instanceof List<?> pair && pair.size() == 2 && pair.get(0) instanceof String attr) {
                return new LookupRef(attr, pair.get(1));
            }
        }
        if (raw instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            for (Object item : list) {
                converted.add(value(item));
            }
            return converted;
        }
        return raw;
    }

    private static String attribute(Object raw, Object entry) {
        if (raw instanceof String str && !str.isBlank()) {
            return str;
        }
        throw new InvalidTransactionException("attribute names must be non-empty strings", entry);
    }

    private static void requireArity(List<?> list, int size, Object entry) {
        if (list.size() != size) {
            throw new InvalidTransactionException(list.get(0) + " expects " + (size - 1) + " arguments", entry);
        }
    }
}
