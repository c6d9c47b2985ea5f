package work.arachne.config.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.arachne.config.dsl.Provenance;
import work.arachne.config.store.ConfigGraph;

class ConfigScriptExceptionTest {
    @Test
    void messagesInterpolateData() {
        var ex = new UnresolvedReferenceException(ConfigGraph.empty(), "app/db", "arachne.core/ref");

        assertEquals("Could not find entity identified by `app/db`", ex.getMessage());
        assertEquals("nonexistent-aid", ex.code());
        assertSame(ex.graph(), ex.data("cfg"));
        assertTrue(ex.explain().contains("from a `arachne.core/ref` DSL form"), ex::explain);
    }

    @Test
    void unknownPlaceholdersAreKept() {
        var definition = new ErrorDefinition("x", "value :known and :unknown", null, null, null);

        assertEquals("value 1 and :unknown", definition.renderMessage(Map.of("known", 1)));
    }

    @Test
    void explainListsSuggestionsProvenanceAndFrames() {
        var ex = new ModuleNotFoundException("app.web");
        ex.withProvenance(new Provenance("arachne.core/entity", List.of("a"), null));
        ex.withProvenance(new Provenance("outer/form", List.of(), null));
        ex.withScriptTrace(List.of(new StackTraceElement("<js>", ":program", "arachne-config-script-x-1-abc.js", 2)));

        String explained = ex.explain();
        assertTrue(explained.startsWith("Could not find config module `app.web`"), explained);
        assertTrue(explained.contains("Suggestions:"), explained);
        assertTrue(explained.contains("While evaluating DSL form: arachne.core/entity"), explained);
        assertTrue(explained.contains("arachne-config-script-x-1-abc.js:2"), explained);
        assertEquals("arachne.core/entity", ex.provenance().function());
    }

    @Test
    void scopeErrorHasFixedMessage() {
        var ex = new ScopeException();
        assertEquals("Cannot reference context config in non-script context", ex.getMessage());
        assertTrue(ex.data().isEmpty());
    }
}
