package work.arachne.config.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.arachne.config.error.InvalidTransactionException;

class TxDataTest {
    @Test
    void parsesEveryEntryShape() {
        var ops = TxData.parse(List.of(
            Map.of("db/id", "server", "port", 8080),
            List.of("db/add", List.of("arachne/id", "app"), "server", Map.of("tempid", "server")),
            List.of("db/retract", 7, "old"),
            List.of("db/retractEntity", Map.of("lookup", List.of("arachne/id", "gone"))),
            List.of("create-entity", Map.of("id", 1))
        ));

        assertEquals(5, ops.size());
        var server = (TxOp.EntityMap) ops.get(0);
        assertEquals(TempId.of("server"), server.id());
        assertEquals(Map.of("port", 8080), server.attributes());

        var add = (TxOp.Add) ops.get(1);
        assertEquals(LookupRef.aid("app"), add.entity());
        assertEquals(TempId.of("server"), add.value());

        assertEquals(new TxOp.Retract(new EntityRef(7), "old"), ops.get(2));
        assertEquals(new TxOp.RetractEntity(LookupRef.aid("gone")), ops.get(3));
        assertEquals(TxOp.EntityMap.of(Map.of("id", 1)), ops.get(4));
    }

    @Test
    void nullIsAnEmptyBatch() {
        assertTrue(TxData.parse(null).isEmpty());
    }

    @Test
    void rejectsMalformedEntries() {
        assertThrows(InvalidTransactionException.class, () -> TxData.parse(Map.of("a", 1)));
        assertThrows(InvalidTransactionException.class, () -> TxData.parse(List.of(List.of("db/add", 1, "x"))));
        assertThrows(InvalidTransactionException.class, () -> TxData.parse(List.of(List.of("db/explode", 1))));
        assertThrows(InvalidTransactionException.class, () -> TxData.parse(List.of(42)));
    }

    @Test
    void loadsYamlText() {
        var ops = TxDataLoader.parse("""
            - arachne/id: app/db
              url: "jdbc:h2:mem:test"
            - ["db/add", ["arachne/id", "app/db"], "pool", 4]
            """);

        assertEquals(2, ops.size());
        var store = new InMemoryEntityStore();
        var graph = store.apply(store.empty(), ops);
        assertEquals(4L, store.attr(graph, LookupRef.aid("app/db"), "pool").orElseThrow());
    }
}
