package work.arachne.config.module;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Discovers modules declared in {@code modules.toml} manifests below a set of root directories.
 *
 * <pre>
 * [module."app.web"]
 * source = "web.js"          # relative to the manifest
 * config = true              # tagged as a configuration module
 * requires = ["app.base"]
 * </pre>
 */
public final class ManifestModuleCatalog implements ModuleCatalog {
    public static final String MANIFEST_NAME = "modules.toml";
    private static final Logger log = LoggerFactory.getLogger(ManifestModuleCatalog.class);

    private final List<Path> roots;

    public ManifestModuleCatalog(List<Path> roots) {
        this.roots = roots == null
            ? List.of()
            : roots.stream().map(p -> p.toAbsolutePath().normalize()).collect(Collectors.toList());
    }

    public List<Path> roots() {
        return roots;
    }

    @Override
    public Collection<ModuleDescriptor> listModules() {
        Map<String, ModuleDescriptor> modules = new LinkedHashMap<>();
        for (Path root : roots) {
            for (Path manifest : findManifests(root)) {
                for (ModuleDescriptor descriptor : readManifest(manifest)) {
                    ModuleDescriptor previous = modules.putIfAbsent(descriptor.id(), descriptor);
                    if (previous != null) {
                        log.atWarn()
                            .addKeyValue("module", descriptor.id())
                            .addKeyValue("kept", previous.origin())
                            .addKeyValue("ignored", descriptor.origin())
                            .log("Duplicate module declaration");
                    }
                }
            }
        }
        return new ArrayList<>(modules.values());
    }

    private static List<Path> findManifests(Path root) {
        if (!Files.isDirectory(root)) {
            log.atDebug().addKeyValue("root", root).log("Module root does not exist");
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(p -> p.getFileName() != null && MANIFEST_NAME.equals(p.getFileName().toString()))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan module root " + root, ex);
        }
    }

    static List<ModuleDescriptor> readManifest(Path manifest) {
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(manifest));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read module manifest " + manifest, ex);
        }
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid module manifest " + manifest + ": " + result.errors().get(0).toString());
        }
        TomlTable modules = result.getTable("module");
        if (modules == null || modules.isEmpty()) {
            return List.of();
        }
        List<ModuleDescriptor> descriptors = new ArrayList<>();
        for (String id : modules.keySet()) {
            TomlTable table = modules.getTable(List.of(id));
            if (table == null) {
                continue;
            }
            String source = table.getString("source");
            if (source == null || source.isBlank()) {
                throw new IllegalStateException("Module " + id + " in " + manifest + " declares no source");
            }
            boolean config = Boolean.TRUE.equals(table.getBoolean("config"));
            Path sourcePath = manifest.resolveSibling(source);
            descriptors.add(ModuleDescriptor.ofFile(id, config, readRequires(table.getArray("requires")), sourcePath));
        }
        return descriptors;
    }

    private static List<String> readRequires(TomlArray array) {
        if (array == null || array.isEmpty()) {
            return List.of();
        }
        List<String> requires = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            requires.add(array.getString(i));
        }
        return requires;
    }
}
