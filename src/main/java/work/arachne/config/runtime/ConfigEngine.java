package work.arachne.config.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import work.arachne.config.dsl.DslRegistry;
import work.arachne.config.module.ManifestModuleCatalog;
import work.arachne.config.module.ModuleCatalog;
import work.arachne.config.module.ModuleLoader;
import work.arachne.config.store.ConfigGraph;
import work.arachne.config.store.EntityStore;
import work.arachne.config.store.InMemoryEntityStore;
import work.arachne.config.tooling.ScriptRuntime;

/**
 * Wires the entity store, DSL forms, script runtime and module loader behind one entry point.
 * An engine is confined to the thread that uses it; concurrent builds use separate engines.
 */
public final class ConfigEngine implements AutoCloseable {
    private final EntityStore store;
    private final DslRegistry dsl;
    private final ScriptRuntime scripts;
    private final ModuleLoader modules;
    private final InitializerDispatcher dispatcher;

    private ConfigEngine(Builder builder) {
        this.store = builder.store;
        this.dsl = builder.dsl;
        this.scripts = new ScriptRuntime(dsl);
        this.modules = new ModuleLoader(builder.catalog(), scripts);
        FunctionResolver functions = builder.functions.isEmpty()
            ? builder.resolver
            : FunctionResolver.of(builder.functions).orElse(builder.resolver);
        this.dispatcher = new InitializerDispatcher(store, functions, modules, scripts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConfigEngine create() {
        return builder().build();
    }

    public ConfigGraph emptyGraph() {
        return store.empty();
    }

    public ConfigGraph apply(ConfigGraph graph, Initializer initializer) throws Exception {
        return dispatcher.apply(graph, initializer);
    }

    /**
     * Applies {@code initializers} in order, starting from the empty graph.
     */
    public ConfigGraph build(List<Initializer> initializers) throws Exception {
        ConfigGraph graph = store.empty();
        for (Initializer initializer : initializers) {
            graph = dispatcher.apply(graph, initializer);
        }
        return graph;
    }

    public EntityStore store() {
        return store;
    }

    public DslRegistry dsl() {
        return dsl;
    }

    public ModuleLoader modules() {
        return modules;
    }

    public ScriptRuntime scripts() {
        return scripts;
    }

    @Override
    public void close() {
        scripts.close();
    }

    public static final class Builder {
        private EntityStore store = new InMemoryEntityStore();
        private DslRegistry dsl;
        private final List<ModuleCatalog> catalogs = new ArrayList<>();
        private final List<Path> moduleRoots = new ArrayList<>();
        private FunctionResolver resolver = new ReflectiveFunctionResolver();
        private final Map<String, UnaryOperator<ConfigGraph>> functions = new LinkedHashMap<>();

        public Builder store(EntityStore store) {
            this.store = store;
            return this;
        }

        public Builder dsl(DslRegistry dsl) {
            this.dsl = dsl;
            return this;
        }

        public Builder catalog(ModuleCatalog catalog) {
            this.catalogs.add(catalog);
            return this;
        }

        public Builder moduleRoots(List<Path> roots) {
            this.moduleRoots.addAll(roots);
            return this;
        }

        public Builder resolver(FunctionResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder function(String name, UnaryOperator<ConfigGraph> function) {
            this.functions.put(name, function);
            return this;
        }

        private ModuleCatalog catalog() {
            List<ModuleCatalog> all = new ArrayList<>(catalogs);
            if (!moduleRoots.isEmpty()) {
                all.add(new ManifestModuleCatalog(moduleRoots));
            }
            if (all.isEmpty()) {
                return ModuleCatalog.empty();
            }
            return all.size() == 1 ? all.get(0) : ModuleCatalog.composite(all);
        }

        public ConfigEngine build() {
            if (dsl == null) {
                dsl = DslRegistry.withCoreForms();
            }
            return new ConfigEngine(this);
        }
    }
}
