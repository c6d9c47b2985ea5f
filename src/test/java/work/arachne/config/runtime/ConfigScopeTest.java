package work.arachne.config.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import work.arachne.config.error.ScopeException;
import work.arachne.config.error.UnresolvedReferenceException;
import work.arachne.config.store.ConfigGraph;
import work.arachne.config.store.InMemoryEntityStore;
import work.arachne.config.store.TempId;
import work.arachne.config.store.TxOp;

class ConfigScopeTest {
    private final InMemoryEntityStore store = new InMemoryEntityStore();

    @Test
    void accessOutsideOfScopeFails() {
        assertFalse(ConfigScope.isActive());
        var ex = assertThrows(ScopeException.class, ConfigScope::currentGraph);
        assertEquals("context-config-outside-of-script", ex.code());
        assertThrows(ScopeException.class, () -> ConfigScope.transact(List.of()));
        assertThrows(ScopeException.class, () -> ConfigScope.resolveId("a"));
    }

    @Test
    void updatesAreVisibleAndReturned() throws Exception {
        var initial = store.empty();
        var result = ConfigScope.withScope(store, initial, () -> {
            assertSame(initial, ConfigScope.currentGraph());
            var ref = ConfigScope.transact(
                List.of(TxOp.EntityMap.withTempId("t", Map.of(ConfigGraph.AID, "a"))), TempId.of("t")).orElseThrow();
            assertEquals(ref, ConfigScope.resolveId("a"));
            return ref;
        });

        assertEquals(result.value(), result.graph().byAid("a").orElseThrow());
        assertTrue(initial.isEmpty());
        assertFalse(ConfigScope.isActive());
    }

    @Test
    void updateWithPassesEveryExtraArgument() throws Exception {
        var result = ConfigScope.withScope(store, store.empty(), () -> ConfigScope.updateWith(
            (graph, args) -> store.apply(graph, List.of(TxOp.EntityMap.of(Map.of(
                ConfigGraph.AID, args.get(0),
                "host", args.get(1),
                "port", args.get(2))))),
            "app/server", "localhost", 8080));

        var server = result.graph().byAid("app/server").orElseThrow();
        assertEquals("localhost", store.attr(result.graph(), server, "host").orElseThrow());
        assertEquals(8080L, store.attr(result.graph(), server, "port").orElseThrow());
        assertSame(result.graph(), result.value());
    }

    @Test
    void nestedScopesRestoreTheOuterGraph() throws Exception {
        var outer = ConfigScope.withScope(store, store.empty(), () -> {
            ConfigScope.transact(List.of(TxOp.EntityMap.of(Map.of(ConfigGraph.AID, "outer"))));
            var inner = ConfigScope.withScope(store, store.empty(), () -> {
                ConfigScope.transact(List.of(TxOp.EntityMap.of(Map.of(ConfigGraph.AID, "inner"))));
                return ConfigScope.currentGraph().size();
            });
            assertEquals(1, inner.value());
            assertTrue(inner.graph().byAid("outer").isEmpty());
            return ConfigScope.currentGraph();
        });

        assertTrue(outer.value().byAid("outer").isPresent());
        assertTrue(outer.value().byAid("inner").isEmpty());
    }

    @Test
    void scopeIsUnboundWhenBodyThrows() {
        assertThrows(IllegalStateException.class, () -> ConfigScope.withScope(store, store.empty(), () -> {
            throw new IllegalStateException("boom");
        }));
        assertFalse(ConfigScope.isActive());
    }

    @Test
    void scopesAreThreadConfined() throws Exception {
        var executor = Executors.newSingleThreadExecutor();
        try {
            ConfigScope.withScope(store, store.empty(), () -> {
                assertFalse(executor.submit(ConfigScope::isActive).get());
                return null;
            });
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void unresolvedAidCarriesGraphAndAid() throws Exception {
        ConfigScope.withScope(store, store.empty(), () -> {
            var ex = assertThrows(UnresolvedReferenceException.class, () -> ConfigScope.resolveId("missing"));
            assertEquals("missing", ex.aid());
            assertSame(ConfigScope.currentGraph(), ex.graph());
            return null;
        });
    }
}
