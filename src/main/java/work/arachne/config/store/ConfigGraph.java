package work.arachne.config.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import work.arachne.config.shared.Values;

/**
 * Immutable configuration graph: the entities asserted so far plus the bookkeeping needed to keep
 * rebuilding deterministic. Instances are produced by an {@link EntityStore}; two graphs built by the
 * same transactions compare equal.
 */
public final class ConfigGraph {
    /** Pseudo attribute naming the entity itself. */
    public static final String DB_ID = "db/id";
    /** Identity attribute carrying the user-facing Arachne ID of an entity. */
    public static final String AID = "arachne/id";

    private static final ConfigGraph EMPTY = new ConfigGraph(new TreeMap<>(), 1L, Map.of(), List.of());

    private final SortedMap<EntityRef, Map<String, Object>> entities;
    private final long nextId;
    private final Map<TempId, EntityRef> tempIds;
    private final List<TxRecord> history;

    ConfigGraph(SortedMap<EntityRef, Map<String, Object>> entities, long nextId, Map<TempId, EntityRef> tempIds, List<TxRecord> history) {
        this.entities = Collections.unmodifiableSortedMap(entities);
        this.nextId = nextId;
        this.tempIds = Map.copyOf(tempIds);
        this.history = List.copyOf(history);
    }

    public static ConfigGraph empty() {
        return EMPTY;
    }

    public Optional<Map<String, Object>> entity(EntityRef ref) {
        return Optional.ofNullable(entities.get(ref));
    }

    public boolean contains(EntityRef ref) {
        return entities.containsKey(ref);
    }

    public Set<EntityRef> entityRefs() {
        return entities.keySet();
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /**
     * First entity (in creation order) whose {@code attribute} equals {@code value}.
     */
    public Optional<EntityRef> lookup(String attribute, Object value) {
        return lookup(entities, attribute, value);
    }

    public Optional<EntityRef> byAid(String aid) {
        return lookup(AID, aid);
    }

    /**
     * Tempids bound by the most recent transaction.
     */
    public Map<TempId, EntityRef> tempIds() {
        return tempIds;
    }

    public List<TxRecord> history() {
        return history;
    }

    long nextId() {
        return nextId;
    }

    SortedMap<EntityRef, Map<String, Object>> entityTable() {
        return entities;
    }

    static Optional<EntityRef> lookup(Map<EntityRef, ? extends Map<String, Object>> table, String attribute, Object value) {
        Object wanted = Values.normalize(value);
        for (var entry : table.entrySet()) {
            Object current = entry.getValue().get(attribute);
            if (current != null && current.equals(wanted)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        List<Map<String, Object>> rendered = new ArrayList<>();
        for (var entry : entities.entrySet()) {
            Map<String, Object> entity = new LinkedHashMap<>();
            entity.put(DB_ID, entry.getKey().id());
            entry.getValue().forEach((k, v) -> entity.put(k, serializable(v)));
            rendered.add(entity);
        }
        out.put("entities", rendered);
        List<Map<String, Object>> txs = new ArrayList<>();
        for (TxRecord record : history) {
            Map<String, Object> tx = new LinkedHashMap<>();
            tx.put("tx", record.tx());
            tx.put("dslFunction", record.dslFunction());
            tx.put("ops", record.ops());
            txs.add(tx);
        }
        out.put("transactions", txs);
        return out;
    }

    private static Object serializable(Object value) {
        if (value instanceof EntityRef ref) {
            return Map.of(DB_ID, ref.id());
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(serializable(item));
            }
            return copy;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigGraph other)) return false;
        return nextId == other.nextId
            && entities.equals(other.entities)
            && tempIds.equals(other.tempIds)
            && history.equals(other.history);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entities, nextId, tempIds, history);
    }

    @Override
    public String toString() {
        return "ConfigGraph{entities=" + entities.size() + ", transactions=" + history.size() + "}";
    }

    /**
     * One applied transaction: its sequence number, the DSL form in effect when it ran (if any) and
     * the number of operations it carried.
     */
    public record TxRecord(long tx, String dslFunction, int ops) {}
}
