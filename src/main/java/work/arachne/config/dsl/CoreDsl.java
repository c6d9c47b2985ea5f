package work.arachne.config.dsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.arachne.config.runtime.ConfigScope;
import work.arachne.config.store.ConfigGraph;
import work.arachne.config.store.EntityRef;
import work.arachne.config.store.TempId;
import work.arachne.config.store.TxData;
import work.arachne.config.store.TxOp;

/**
 * Built-in DSL forms for creating and linking entities identified by Arachne IDs.
 */
public final class CoreDsl {
    public static final String NAMESPACE = "arachne.core";
    public static final String DEPENDENCIES = "arachne/dependencies";

    private static final TempId ENTITY_TEMPID = TempId.of("arachne.core/entity");

    private CoreDsl() {}

    public static DslRegistry register(DslRegistry registry) {
        registry.register(DslFunction.define(
            NAMESPACE + "/entity",
            "Create (or update) the entity with the given Arachne ID and return its ref.",
            ArgSpec.builder().required("aid", ArgType.AID).optional("attributes", ArgType.MAP).build(),
            CoreDsl::entity
        ));
        registry.register(DslFunction.define(
            NAMESPACE + "/attr",
            "Set one attribute on an existing entity.",
            ArgSpec.builder()
                .required("aid", ArgType.AID)
                .required("attribute", ArgType.STRING)
                .required("value", ArgType.ANY)
                .build(),
            CoreDsl::attr
        ));
        registry.register(DslFunction.define(
            NAMESPACE + "/ref",
            "Return the ref of an existing entity.",
            ArgSpec.builder().required("aid", ArgType.AID).build(),
            args -> ConfigScope.resolveId(args.string("aid"))
        ));
        registry.register(DslFunction.define(
            NAMESPACE + "/depends",
            "Declare that an entity depends on other, already defined, entities.",
            ArgSpec.builder().required("aid", ArgType.AID).rest("dependencies", ArgType.AID).build(),
            CoreDsl::depends
        ));
        registry.register(DslFunction.define(
            NAMESPACE + "/transact",
            "Transact raw tx data; returns the ref bound to the optional tempid.",
            ArgSpec.builder().required("txdata", ArgType.LIST).optional("tempid", ArgType.STRING).build(),
            CoreDsl::transact
        ));
        return registry;
    }

    private static Object entity(DslArgs args) {
        Map<String, Object> attributes = new LinkedHashMap<>(args.map("attributes"));
        attributes.put(ConfigGraph.AID, args.string("aid"));
        List<TxOp> ops = List.of(new TxOp.EntityMap(ENTITY_TEMPID, attributes));
        return ConfigScope.transact(ops, ENTITY_TEMPID).orElseThrow();
    }

    private static Object attr(DslArgs args) {
        EntityRef ref = ConfigScope.resolveId(args.string("aid"));
        ConfigScope.transact(List.of(new TxOp.Add(ref, args.string("attribute"), args.get("value"))));
        return ref;
    }

    private static Object depends(DslArgs args) {
        EntityRef ref = ConfigScope.resolveId(args.string("aid"));
        List<Object> dependencies = new ArrayList<>();
        ConfigScope.attr(ref, DEPENDENCIES).ifPresent(existing -> {
            if (existing instanceof List<?> list) {
                dependencies.addAll(list);
            }
        });
        for (Object aid : args.list("dependencies")) {
            EntityRef dependency = ConfigScope.resolveId((String) aid);
            if (!dependencies.contains(dependency)) {
                dependencies.add(dependency);
            }
        }
        ConfigScope.transact(List.of(new TxOp.Add(ref, DEPENDENCIES, dependencies)));
        return ref;
    }

    private static Object transact(DslArgs args) {
        List<TxOp> ops = TxData.parse(args.list("txdata"));
        String tempid = args.string("tempid");
        if (tempid == null) {
            ConfigScope.transact(ops);
            return null;
        }
        return ConfigScope.transact(ops, TempId.of(tempid)).orElse(null);
    }
}
