package work.arachne.config.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.arachne.config.runtime.Initializer;

/**
 * Immutable description of one configuration build.
 */
public record ConfigBuildConfiguration(
    List<Initializer> initializers,
    List<Path> moduleRoots,
    LogLevel logLevel,
    Optional<Path> output
) {
    public static final String WORKSPACE_FILE = "arachne.toml";

    public ConfigBuildConfiguration {
        initializers = List.copyOf(Objects.requireNonNull(initializers, "initializers"));
        moduleRoots = List.copyOf(Objects.requireNonNull(moduleRoots, "moduleRoots"));
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(output, "output");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code [build]} table of a workspace file. {@code workspace} may be the file itself
     * or the directory holding {@value #WORKSPACE_FILE}; relative paths resolve against that directory.
     */
    public static Builder fromWorkspace(Path workspace) throws IOException {
        Path file = Files.isDirectory(workspace) ? workspace.resolve(WORKSPACE_FILE) : workspace;
        Path baseDir = file.toAbsolutePath().getParent();
        TomlParseResult toml = Toml.parse(file);
        if (toml.hasErrors()) {
            throw new IOException("Invalid workspace file " + file + ": " + toml.errors().get(0));
        }
        Builder builder = new Builder();
        TomlTable build = toml.getTable("build");
        if (build == null) {
            return builder;
        }
        for (String root : strings(build.getArray("module-roots"))) {
            builder.moduleRoot(baseDir.resolve(root).normalize());
        }
        for (String spec : strings(build.getArray("initializers"))) {
            builder.initializer(Initializer.parse(spec, baseDir));
        }
        String level = build.getString("log-level");
        if (level != null) {
            builder.logLevel(LogLevel.from(level));
        }
        return builder;
    }

    private static List<String> strings(TomlArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    public static final class Builder {
        private final List<Initializer> initializers = new ArrayList<>();
        private final List<Path> moduleRoots = new ArrayList<>();
        private LogLevel logLevel = LogLevel.WARN;
        private Path output;

        public Builder initializer(Initializer initializer) {
            this.initializers.add(initializer);
            return this;
        }

        public Builder initializers(List<Initializer> initializers) {
            this.initializers.addAll(initializers);
            return this;
        }

        public Builder moduleRoot(Path root) {
            this.moduleRoots.add(root);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder output(Path output) {
            this.output = output;
            return this;
        }

        public ConfigBuildConfiguration build() {
            return new ConfigBuildConfiguration(initializers, moduleRoots, logLevel, Optional.ofNullable(output));
        }
    }
}
