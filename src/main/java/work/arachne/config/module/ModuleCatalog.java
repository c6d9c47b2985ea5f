package work.arachne.config.module;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Discovery of the modules that may be loaded by a build.
 */
@FunctionalInterface
public interface ModuleCatalog {
    /**
     * Every module currently discoverable. Called once per module load so that changes on disk are
     * picked up between builds.
     */
    Collection<ModuleDescriptor> listModules();

    default Optional<ModuleDescriptor> find(String id) {
        return listModules().stream().filter(d -> d.id().equals(id)).findFirst();
    }

    static ModuleCatalog of(ModuleDescriptor... descriptors) {
        List<ModuleDescriptor> fixed = List.of(descriptors);
        return () -> fixed;
    }

    static ModuleCatalog empty() {
        return List::of;
    }

    /**
     * Concatenation of several catalogues; earlier catalogues win on duplicate identifiers.
     */
    static ModuleCatalog composite(List<ModuleCatalog> catalogs) {
        List<ModuleCatalog> copy = List.copyOf(catalogs);
        return () -> {
            List<ModuleDescriptor> all = new ArrayList<>();
            for (ModuleCatalog catalog : copy) {
                for (ModuleDescriptor descriptor : catalog.listModules()) {
                    if (all.stream().noneMatch(d -> d.id().equals(descriptor.id()))) {
                        all.add(descriptor);
                    }
                }
            }
            return all;
        };
    }
}
