package work.arachne.config.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.arachne.config.error.ArgumentValidationException;
import work.arachne.config.error.ModuleNotFoundException;
import work.arachne.config.error.ScriptEvaluationException;
import work.arachne.config.error.UnresolvedFunctionException;
import work.arachne.config.error.UnresolvedReferenceException;
import work.arachne.config.module.ModuleCatalog;
import work.arachne.config.module.ModuleDescriptor;
import work.arachne.config.store.ConfigGraph;
import work.arachne.config.store.EntityRef;
import work.arachne.config.store.LookupRef;
import work.arachne.config.store.TxOp;
import work.arachne.config.support.ConfigTestSupport;

class ConfigEngineTest {
    private final ConfigEngine engine = ConfigEngine.builder()
        .catalog(ModuleCatalog.of(
            ModuleDescriptor.ofSource("app.base", false, List.of(), "exports.port = 8080;"),
            ModuleDescriptor.ofSource("app.web", true, List.of("app.base"),
                "const base = require('app.base');\n"
                    + "dsl.entity('app/web', { port: base.port });\n"),
            ModuleDescriptor.ofSource("app.lib", false, List.of(), "exports.x = 1;"),
            ModuleDescriptor.ofSource("app.counter", true, List.of(),
                "globalThis.counter = (globalThis.counter || 0) + 1;\n"
                    + "dsl.entity('app/counter', { n: globalThis.counter });\n"),
            ModuleDescriptor.ofSource("app.shared", false, List.of(), "globalThis.sharedValue = 7;"),
            ModuleDescriptor.ofSource("app.uses-shared", true, List.of("app.shared"),
                "dsl.entity('app/shared', { v: globalThis.sharedValue });")
        ))
        .function("add-root", ConfigTestSupport::addRoot)
        .build();

    @AfterEach
    void closeEngine() {
        engine.close();
    }

    @Test
    void opsBatchCreatesEntity() throws Exception {
        var graph = engine.apply(engine.emptyGraph(),
            Initializer.opsData(List.of(List.of("create-entity", Map.of("id", 1)))));

        var ref = engine.store().attr(graph, new LookupRef("id", 1), ConfigGraph.DB_ID);
        assertTrue(ref.isPresent());
        assertTrue(ref.get() instanceof EntityRef);
    }

    @Test
    void emptyInitializersAreNoOps() throws Exception {
        var graph = engine.emptyGraph();
        assertSame(graph, engine.apply(graph, Initializer.ops(List.of())));
        assertSame(graph, engine.apply(graph, Initializer.script("   ")));
        assertSame(graph, engine.apply(graph, null));
    }

    @Test
    void namedFunctionsResolveFromRegistryAndReflection() throws Exception {
        var registered = engine.apply(engine.emptyGraph(), Initializer.function("add-root"));
        var reflective = engine.apply(engine.emptyGraph(),
            Initializer.function(ConfigTestSupport.class.getName() + "#addRoot"));

        assertEquals(registered, reflective);
        assertEquals("root", ConfigTestSupport.attr(registered, ConfigTestSupport.ROOT_AID, "test/kind").orElseThrow());
    }

    @Test
    void unresolvableFunctionFails() {
        assertThrows(UnresolvedFunctionException.class,
            () -> engine.apply(engine.emptyGraph(), Initializer.function("no.such.Type#init")));
        assertThrows(UnresolvedFunctionException.class,
            () -> engine.apply(engine.emptyGraph(),
                Initializer.function(ConfigTestSupport.class.getName() + "#notAnInitializer")));
    }

    @Test
    void inlineScriptUsesDslAndConfigBindings() throws Exception {
        var graph = engine.apply(engine.emptyGraph(), Initializer.script("""
            const server = dsl.entity('app/server', { host: 'localhost' });
            dsl.attr('app/server', 'port', 8080);
            dsl.call('arachne.core/entity', 'app/client');
            dsl.depends('app/client', 'app/server');
            config.transact([["db/add", ["arachne/id", "app/client"], "retries", 3]]);
            if (config.attr('app/server', 'db/id') === null) { throw new Error('no server'); }
            """));

        var server = graph.byAid("app/server").orElseThrow();
        assertEquals(8080L, ConfigTestSupport.attr(graph, "app/server", "port").orElseThrow());
        assertEquals(List.of(server), ConfigTestSupport.attr(graph, "app/client", "arachne/dependencies").orElseThrow());
        assertEquals(3L, ConfigTestSupport.attr(graph, "app/client", "retries").orElseThrow());
    }

    @Test
    void transactionsRecordTheirDslForm() throws Exception {
        var graph = engine.apply(engine.emptyGraph(), Initializer.script("dsl.entity('a');"));

        assertEquals("arachne.core/entity", graph.history().get(0).dslFunction());
    }

    @Test
    void scriptFileIsEvaluated(@TempDir Path dir) throws Exception {
        var script = dir.resolve("init.js");
        Files.writeString(script, "dsl.entity('from/file', { ok: true });\n");

        var graph = engine.apply(engine.emptyGraph(), Initializer.file(script));

        assertEquals(true, ConfigTestSupport.attr(graph, "from/file", "ok").orElseThrow());
    }

    @Test
    void moduleInitializerLoadsRequirementsFirst() throws Exception {
        var graph = engine.apply(engine.emptyGraph(), Initializer.module("app.web"));

        assertEquals(8080L, ConfigTestSupport.attr(graph, "app/web", "port").orElseThrow());
        assertTrue(engine.modules().loadedModules().contains("app.base"));
    }

    @Test
    void buildsAreDeterministic() throws Exception {
        List<Initializer> initializers = List.of(
            Initializer.function("add-root"),
            Initializer.module("app.web"),
            Initializer.script("dsl.depends('app/web', 'test/root');")
        );

        var first = engine.build(initializers);
        var second = engine.build(initializers);

        assertEquals(first, second);
        assertEquals(first.toSerializableMap(), second.toSerializableMap());
    }

    @Test
    void globalsWrittenByConfigModulesDoNotSurviveRebuilds() throws Exception {
        List<Initializer> initializers = List.of(Initializer.module("app.counter"));

        var first = engine.build(initializers);
        var second = engine.build(initializers);

        assertEquals(1L, ConfigTestSupport.attr(first, "app/counter", "n").orElseThrow());
        assertEquals(first, second);
    }

    @Test
    void globalsWrittenByInlineScriptsAreClearedBeforeTheNextScript() throws Exception {
        var graph = engine.build(List.of(
            Initializer.script("globalThis.leaked = 'yes';"),
            Initializer.script("dsl.entity('app/after', { seen: typeof globalThis.leaked });")
        ));

        assertEquals("undefined", ConfigTestSupport.attr(graph, "app/after", "seen").orElseThrow());
    }

    @Test
    void implicitGlobalsAreRejected() {
        var ex = assertThrows(ScriptEvaluationException.class,
            () -> engine.apply(engine.emptyGraph(), Initializer.script("counter = 1;")));

        assertTrue(ex.getMessage().contains("counter"), ex::getMessage);
    }

    @Test
    void libraryModuleGlobalsStayAvailable() throws Exception {
        List<Initializer> initializers = List.of(Initializer.module("app.uses-shared"));

        var first = engine.build(initializers);
        var second = engine.build(initializers);

        assertEquals(7L, ConfigTestSupport.attr(second, "app/shared", "v").orElseThrow());
        assertEquals(first, second);
    }

    @Test
    void failingInitializerLeavesInputGraphAsItWas() throws Exception {
        var before = engine.apply(engine.emptyGraph(), Initializer.function("add-root"));

        var ex = assertThrows(UnresolvedReferenceException.class, () -> engine.apply(before, Initializer.script(
            "dsl.entity('half/done');\ndsl.depends('half/done', 'never/defined');\n")));

        assertEquals("never/defined", ex.aid());
        assertEquals("arachne.core/depends", ex.dslFunction());
        assertEquals("arachne.core/depends", ex.provenance().function());
        assertFalse(ex.scriptTrace().isEmpty());
        assertEquals(1, before.size());
        assertTrue(before.byAid("half/done").isEmpty());
        assertFalse(ConfigScope.isActive());
    }

    @Test
    void dslArgumentsAreValidatedBeforeTheBodyRuns() {
        var ex = assertThrows(ArgumentValidationException.class,
            () -> engine.apply(engine.emptyGraph(), Initializer.script("dsl.entity(42);")));

        assertEquals("arachne.core/entity", ex.dslFunction());
        assertEquals(1, ex.problems().size());
    }

    @Test
    void guestErrorsBecomeScriptEvaluationExceptions() {
        var ex = assertThrows(ScriptEvaluationException.class,
            () -> engine.apply(engine.emptyGraph(), Initializer.script("throw new Error('bad script');")));

        assertTrue(ex.getMessage().contains("bad script"), ex::getMessage);
    }

    @Test
    void unknownModuleFails() {
        var ex = assertThrows(ModuleNotFoundException.class,
            () -> engine.apply(engine.emptyGraph(), Initializer.module("app.missing")));
        assertEquals("app.missing", ex.moduleId());
    }

    @Test
    void functionUpdatesApplyOnTopOfInput() throws Exception {
        var seeded = engine.apply(engine.emptyGraph(), Initializer.ops(List.of(TxOp.EntityMap.of(Map.of(ConfigGraph.AID, "seed")))));
        var graph = engine.apply(seeded, Initializer.function("add-root"));

        assertEquals(2, graph.size());
    }
}
