package work.arachne.config.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.arachne.config.dsl.Provenance;
import work.arachne.config.error.InvalidTransactionException;
import work.arachne.config.shared.Values;

/**
 * Copy-on-write {@link EntityStore}. A transaction works on a private copy of the entity table and
 * only produces a new graph once every operation has been validated, so a rejected transaction
 * leaves no trace.
 */
public final class InMemoryEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    @Override
    public ConfigGraph empty() {
        return ConfigGraph.empty();
    }

    @Override
    public ConfigGraph apply(ConfigGraph graph, List<TxOp> ops) {
        if (ops == null || ops.isEmpty()) {
            return graph;
        }
        var tx = new Transaction(graph);
        tx.bindUpsertTargets(ops);
        for (TxOp op : ops) {
            tx.apply(op);
        }
        String dslFunction = Provenance.currentFunctionName().orElse(null);
        ConfigGraph next = tx.commit(dslFunction, ops.size());
        log.atTrace()
            .addKeyValue("tx", next.history().size())
            .addKeyValue("ops", ops.size())
            .addKeyValue("dslFunction", dslFunction)
            .addKeyValue("entities", next.size())
            .log("Applied transaction");
        return next;
    }

    @Override
    public Optional<EntityRef> resolveTempId(ConfigGraph graph, TempId tempId) {
        if (graph == null || tempId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(graph.tempIds().get(tempId));
    }

    @Override
    public Optional<Object> attr(ConfigGraph graph, Object entity, String attribute) {
        Optional<EntityRef> ref = find(graph, entity);
        if (ref.isEmpty()) {
            return Optional.empty();
        }
        if (ConfigGraph.DB_ID.equals(attribute)) {
            return Optional.of(ref.get());
        }
        return graph.entity(ref.get()).map(attrs -> attrs.get(attribute));
    }

    private static Optional<EntityRef> find(ConfigGraph graph, Object entity) {
        if (entity instanceof EntityRef ref) {
            return graph.contains(ref) ? Optional.of(ref) : Optional.empty();
        }
        if (entity instanceof LookupRef lookup) {
            return graph.lookup(lookup.attribute(), lookup.value());
        }
        if (entity instanceof Number number) {
            return find(graph, new EntityRef(number.longValue()));
        }
        return Optional.empty();
    }

    private static final class Transaction {
        private final ConfigGraph base;
        private final TreeMap<EntityRef, Map<String, Object>> entities = new TreeMap<>();
        private final Map<TempId, EntityRef> tempIds = new LinkedHashMap<>();
        private final Map<Object, EntityRef> upsertTargets = new HashMap<>();
        private long nextId;

        Transaction(ConfigGraph base) {
            this.base = base;
            this.nextId = base.nextId();
            base.entityTable().forEach((ref, attrs) -> entities.put(ref, new LinkedHashMap<>(attrs)));
        }

        /**
         * Resolves, before any op runs, the entity each Arachne ID of the transaction upserts into,
         * and binds the tempids of those entity maps to it. Uses of such a tempid earlier in the
         * transaction then already point at the upsert target.
         */
        void bindUpsertTargets(List<TxOp> ops) {
            for (TxOp op : ops) {
                if (!(op instanceof TxOp.EntityMap map) || !(map.id() == null || map.id() instanceof TempId)) {
                    continue;
                }
                Object aid = map.attributes().get(ConfigGraph.AID);
                if (aid == null) {
                    continue;
                }
                EntityRef target = upsertTargets.computeIfAbsent(Values.normalize(aid),
                    key -> ConfigGraph.lookup(entities, ConfigGraph.AID, key).orElseGet(this::allocate));
                if (map.id() instanceof TempId tempId) {
                    tempIds.putIfAbsent(tempId, target);
                }
            }
        }

        void apply(TxOp op) {
            if (op instanceof TxOp.EntityMap map) {
                applyEntityMap(map);
            } else if (op instanceof TxOp.Add add) {
                EntityRef target = resolveEntity(add.entity(), op);
                put(target, add.attribute(), add.value(), op);
            } else if (op instanceof TxOp.Retract retract) {
                EntityRef target = resolveEntity(retract.entity(), op);
                entities.get(target).remove(retract.attribute());
            } else if (op instanceof TxOp.RetractEntity retractEntity) {
                EntityRef target = resolveEntity(retractEntity.entity(), op);
                entities.remove(target);
                removeReferencesTo(target);
            } else {
                throw new InvalidTransactionException("unsupported operation", op);
            }
        }

        private void applyEntityMap(TxOp.EntityMap map) {
            Object aid = map.attributes().get(ConfigGraph.AID);
            Optional<EntityRef> existing = aid == null
                ? Optional.empty()
                : Optional.ofNullable(upsertTargets.get(Values.normalize(aid)))
                    .or(() -> ConfigGraph.lookup(entities, ConfigGraph.AID, aid))
                    .filter(entities::containsKey);
            EntityRef target;
            Object id = map.id();
            if (id == null) {
                target = existing.orElseGet(this::allocate);
            } else if (id instanceof TempId tempId && !tempIds.containsKey(tempId)) {
                target = existing.orElseGet(this::allocate);
                tempIds.put(tempId, target);
            } else {
                target = resolveEntity(id, map);
                if (existing.isPresent() && !existing.get().equals(target)) {
                    throw new InvalidTransactionException(
                        "Arachne ID " + aid + " already belongs to entity " + existing.get(), map);
                }
            }
            for (var entry : map.attributes().entrySet()) {
                if (ConfigGraph.DB_ID.equals(entry.getKey())) {
                    continue;
                }
                put(target, entry.getKey(), entry.getValue(), map);
            }
        }

        private void put(EntityRef target, String attribute, Object value, TxOp op) {
            if (value == null) {
                throw new InvalidTransactionException("attribute " + attribute + " has no value", op);
            }
            entities.get(target).put(attribute, resolveValue(value, op));
        }

        private Object resolveValue(Object value, TxOp op) {
            if (value instanceof TempId || value instanceof LookupRef) {
                return resolveEntity(value, op);
            }
            if (value instanceof List<?> list) {
                List<Object> resolved = new ArrayList<>(list.size());
                for (Object item : list) {
                    resolved.add(resolveValue(item, op));
                }
                return Values.normalize(resolved);
            }
            return Values.normalize(value);
        }

        private EntityRef resolveEntity(Object id, TxOp op) {
            if (id instanceof EntityRef ref) {
                if (!entities.containsKey(ref)) {
                    throw new InvalidTransactionException("entity " + ref + " does not exist", op);
                }
                return ref;
            }
            if (id instanceof TempId tempId) {
                return tempIds.computeIfAbsent(tempId, t -> allocate());
            }
            if (id instanceof LookupRef lookup) {
                return ConfigGraph.lookup(entities, lookup.attribute(), lookup.value())
                    .orElseThrow(() -> new InvalidTransactionException("no entity matches " + lookup, op));
            }
            if (id instanceof Number number) {
                return resolveEntity(new EntityRef(number.longValue()), op);
            }
            throw new InvalidTransactionException("cannot use " + Values.describe(id) + " as an entity id", op);
        }

        private EntityRef allocate() {
            EntityRef ref = new EntityRef(nextId++);
            entities.put(ref, new LinkedHashMap<>());
            return ref;
        }

        private void removeReferencesTo(EntityRef target) {
            for (Map<String, Object> attrs : entities.values()) {
                attrs.entrySet().removeIf(e -> target.equals(e.getValue()));
                attrs.replaceAll((k, v) -> {
                    if (v instanceof List<?> list && list.contains(target)) {
                        List<Object> kept = new ArrayList<>(list);
                        kept.removeIf(target::equals);
                        return Values.normalize(kept);
                    }
                    return v;
                });
            }
        }

        ConfigGraph commit(String dslFunction, int opCount) {
            TreeMap<EntityRef, Map<String, Object>> frozen = new TreeMap<>();
            entities.forEach((ref, attrs) -> frozen.put(ref, Collections.unmodifiableMap(new LinkedHashMap<>(attrs))));
            List<ConfigGraph.TxRecord> history = new ArrayList<>(base.history());
            history.add(new ConfigGraph.TxRecord(base.history().size() + 1L, dslFunction, opCount));
            return new ConfigGraph(frozen, nextId, tempIds, history);
        }
    }
}
