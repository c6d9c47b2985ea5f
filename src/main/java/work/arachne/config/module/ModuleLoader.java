package work.arachne.config.module;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.arachne.config.error.ConfigErrors;
import work.arachne.config.error.ConfigScriptException;
import work.arachne.config.error.ModuleNotFoundException;
import work.arachne.config.error.NotAConfigModuleException;
import work.arachne.config.tooling.ScriptNamespace;
import work.arachne.config.tooling.ScriptRuntime;

/**
 * Loads modules into a {@link ScriptRuntime}. Loading a configuration module first unloads every
 * loaded configuration module, so each build evaluates them all from a clean slate; library modules
 * (not tagged as configuration) stay loaded and are shared across builds, together with the script
 * globals they define.
 */
public final class ModuleLoader {
    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    private final ModuleCatalog catalog;
    private final ScriptRuntime runtime;
    private final Map<String, LoadedModule> loaded = new LinkedHashMap<>();
    private final Deque<String> loading = new ArrayDeque<>();

    public ModuleLoader(ModuleCatalog catalog, ScriptRuntime runtime) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
    }

    public ModuleCatalog catalog() {
        return catalog;
    }

    /**
     * Evaluates the configuration module {@code id}, and transitively the modules it requires,
     * after unloading every configuration module.
     *
     * @throws ModuleNotFoundException if no catalogue declares {@code id}
     * @throws NotAConfigModuleException if {@code id} is not tagged as a configuration module
     */
    public ScriptNamespace load(String id) {
        Map<String, ModuleDescriptor> all = index(catalog.listModules());
        ModuleDescriptor descriptor = validateConfigModule(all, id);
        unloadConfigModules();
        log.atDebug().addKeyValue("module", id).addKeyValue("requires", descriptor.requires()).log("Loading config module");
        require(id, all);
        return loaded.get(id).namespace();
    }

    /**
     * Exports of module {@code id}, evaluating it (and its requirements) if it is not loaded yet.
     */
    public Value require(String id) {
        return require(id, null);
    }

    private Value require(String id, Map<String, ModuleDescriptor> known) {
        LoadedModule existing = loaded.get(id);
        if (existing != null) {
            return existing.namespace().exports();
        }
        Map<String, ModuleDescriptor> all = known != null ? known : index(catalog.listModules());
        ModuleDescriptor descriptor = all.get(id);
        if (descriptor == null) {
            throw new ModuleNotFoundException(id);
        }
        if (loading.contains(id)) {
            List<String> cycle = new ArrayList<>(loading);
            Collections.reverse(cycle);
            cycle.add(id);
            throw new ConfigScriptException(ConfigErrors.CYCLIC_MODULE_DEPENDENCY, Map.of("cycle", String.join(" -> ", cycle)));
        }
        loading.push(id);
        try {
            for (String dependency : descriptor.requires()) {
                require(dependency, all);
            }
            String source = readSource(descriptor);
            Set<String> globalsBefore = descriptor.configModule() ? Set.of() : runtime.globalKeys();
            ScriptNamespace namespace = runtime.evaluate(source, id, descriptor.origin(), dep -> require(dep, all));
            if (!descriptor.configModule()) {
                Set<String> defined = runtime.globalKeys();
                defined.removeAll(globalsBefore);
                runtime.retainGlobals(defined);
            }
            loaded.put(id, new LoadedModule(descriptor, namespace));
            log.atTrace()
                .addKeyValue("module", id)
                .addKeyValue("namespace", namespace.name())
                .addKeyValue("config", descriptor.configModule())
                .log("Module loaded");
            return namespace.exports();
        } finally {
            loading.pop();
        }
    }

    public boolean unload(String id) {
        LoadedModule removed = loaded.remove(id);
        if (removed != null) {
            log.atTrace().addKeyValue("module", id).log("Module unloaded");
        }
        return removed != null;
    }

    /**
     * Unloads every loaded configuration module so that the next require evaluates it again. Script
     * globals defined by anything but library modules are deleted as well.
     */
    public void unloadConfigModules() {
        List<String> config = loaded.values().stream()
            .filter(m -> m.descriptor().configModule())
            .map(m -> m.descriptor().id())
            .toList();
        config.forEach(this::unload);
        runtime.resetGlobals();
    }

    public Set<String> loadedModules() {
        return Collections.unmodifiableSet(loaded.keySet());
    }

    public Optional<ScriptNamespace> namespace(String id) {
        return Optional.ofNullable(loaded.get(id)).map(LoadedModule::namespace);
    }

    private static ModuleDescriptor validateConfigModule(Map<String, ModuleDescriptor> all, String id) {
        ModuleDescriptor found = all.get(id);
        if (found == null) {
            throw new ModuleNotFoundException(id);
        }
        if (!found.configModule()) {
            throw new NotAConfigModuleException(id);
        }
        return found;
    }

    private static String readSource(ModuleDescriptor descriptor) {
        try {
            return descriptor.source().read();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read source of module " + descriptor.id() + " (" + descriptor.origin() + ")", ex);
        }
    }

    private static Map<String, ModuleDescriptor> index(Collection<ModuleDescriptor> modules) {
        Map<String, ModuleDescriptor> index = new LinkedHashMap<>();
        for (ModuleDescriptor descriptor : modules) {
            index.putIfAbsent(descriptor.id(), descriptor);
        }
        return index;
    }

    private record LoadedModule(ModuleDescriptor descriptor, ScriptNamespace namespace) {}
}
