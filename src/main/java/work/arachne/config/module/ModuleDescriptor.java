package work.arachne.config.module;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A discoverable module: its identifier, whether it is tagged as a configuration module, the
 * modules it requires and where its source lives.
 */
public record ModuleDescriptor(String id, boolean configModule, List<String> requires, String origin, ModuleSource source) {
    public ModuleDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        requires = requires == null ? List.of() : List.copyOf(requires);
        origin = origin == null ? id : origin;
    }

    public static ModuleDescriptor ofFile(String id, boolean configModule, List<String> requires, Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return new ModuleDescriptor(id, configModule, requires, normalized.toString(),
            () -> Files.readString(normalized, StandardCharsets.UTF_8));
    }

    public static ModuleDescriptor ofSource(String id, boolean configModule, List<String> requires, String source) {
        return new ModuleDescriptor(id, configModule, requires, id, () -> source);
    }
}
