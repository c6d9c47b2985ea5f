package work.arachne.config.module;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.arachne.config.dsl.DslRegistry;
import work.arachne.config.error.ConfigScriptException;
import work.arachne.config.error.ModuleNotFoundException;
import work.arachne.config.error.NotAConfigModuleException;
import work.arachne.config.tooling.ScriptRuntime;

class ModuleLoaderTest {
    private final ScriptRuntime runtime = new ScriptRuntime(DslRegistry.withCoreForms());

    @AfterEach
    void closeRuntime() {
        runtime.close();
    }

    @Test
    void manifestsAreDiscoveredBelowRoots(@TempDir Path root) throws Exception {
        Path nested = Files.createDirectories(root.resolve("nested/pkg"));
        Files.writeString(nested.resolve("modules.toml"), """
            [module."pkg.config"]
            source = "config.js"
            config = true
            requires = ["pkg.lib"]

            [module."pkg.lib"]
            source = "lib/lib.js"
            """);

        var catalog = new ManifestModuleCatalog(List.of(root));
        var config = catalog.find("pkg.config").orElseThrow();
        var lib = catalog.find("pkg.lib").orElseThrow();

        assertTrue(config.configModule());
        assertEquals(List.of("pkg.lib"), config.requires());
        assertFalse(lib.configModule());
        assertEquals(nested.resolve("lib/lib.js").toAbsolutePath().normalize().toString(), lib.origin());
    }

    @Test
    void missingRootsYieldNoModules(@TempDir Path root) {
        assertTrue(new ManifestModuleCatalog(List.of(root.resolve("absent"))).listModules().isEmpty());
    }

    @Test
    void loadValidatesTheModule() {
        var loader = new ModuleLoader(ModuleCatalog.of(
            ModuleDescriptor.ofSource("lib", false, List.of(), "exports.x = 1;")
        ), runtime);

        assertThrows(ModuleNotFoundException.class, () -> loader.load("missing"));
        var ex = assertThrows(NotAConfigModuleException.class, () -> loader.load("lib"));
        assertEquals("lib", ex.moduleId());
        assertTrue(loader.loadedModules().isEmpty());
    }

    @Test
    void configModulesReloadLibrariesStayCached() {
        var loader = new ModuleLoader(ModuleCatalog.of(
            ModuleDescriptor.ofSource("lib", false, List.of(), "exports.x = 1;"),
            ModuleDescriptor.ofSource("cfg", true, List.of("lib"), "exports.y = require('lib').x + 1;")
        ), runtime);

        var first = loader.load("cfg");
        var libNamespace = loader.namespace("lib").orElseThrow().name();
        var second = loader.load("cfg");

        assertNotEquals(first.name(), second.name());
        assertEquals(libNamespace, loader.namespace("lib").orElseThrow().name());
        assertEquals(2, second.exports().getMember("y").asInt());
    }

    @Test
    void unloadConfigModulesKeepsLibraries() {
        var loader = new ModuleLoader(ModuleCatalog.of(
            ModuleDescriptor.ofSource("lib", false, List.of(), ""),
            ModuleDescriptor.ofSource("cfg", true, List.of("lib"), "")
        ), runtime);

        loader.load("cfg");
        loader.unloadConfigModules();

        assertEquals(Set.of("lib"), loader.loadedModules());
        assertTrue(loader.unload("lib"));
        assertFalse(loader.unload("lib"));
    }

    @Test
    void cyclicRequirementsAreReported() {
        var loader = new ModuleLoader(ModuleCatalog.of(
            ModuleDescriptor.ofSource("a", true, List.of("b"), ""),
            ModuleDescriptor.ofSource("b", false, List.of("a"), "")
        ), runtime);

        var ex = assertThrows(ConfigScriptException.class, () -> loader.load("a"));
        assertEquals("cyclic-module-dependency", ex.code());
        assertEquals("a -> b -> a", ex.data("cycle"));
    }

    @Test
    void compositeCatalogPrefersEarlierEntries() {
        var catalog = ModuleCatalog.composite(List.of(
            ModuleCatalog.of(ModuleDescriptor.ofSource("m", true, List.of(), "first")),
            ModuleCatalog.of(ModuleDescriptor.ofSource("m", false, List.of(), "second"))
        ));

        assertEquals(1, catalog.listModules().size());
        assertTrue(catalog.find("m").orElseThrow().configModule());
    }
}
