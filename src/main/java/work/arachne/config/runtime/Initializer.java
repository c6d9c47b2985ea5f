package work.arachne.config.runtime;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import work.arachne.config.store.TxData;
import work.arachne.config.store.TxDataLoader;
import work.arachne.config.store.TxOp;

/**
 * One unit of configuration-building work. Consumed by {@link InitializerDispatcher#apply}.
 */
public sealed interface Initializer
    permits Initializer.NamedFunction, Initializer.ModuleReference, Initializer.ScriptFile,
        Initializer.OpsBatch, Initializer.InlineScript {

    String describe();

    /** Public static {@code ConfigGraph m(ConfigGraph)} method, as {@code pkg.Class#method}. */
    record NamedFunction(String reference) implements Initializer {
        public NamedFunction {
            Objects.requireNonNull(reference, "reference");
            if (reference.isBlank()) {
                throw new IllegalArgumentException("function reference must not be blank");
            }
        }

        @Override
        public String describe() {
            return "fn:" + reference;
        }
    }

    record ModuleReference(String moduleId) implements Initializer {
        public ModuleReference {
            Objects.requireNonNull(moduleId, "moduleId");
            if (moduleId.isBlank()) {
                throw new IllegalArgumentException("module id must not be blank");
            }
        }

        @Override
        public String describe() {
            return "module:" + moduleId;
        }
    }

    record ScriptFile(Path path) implements Initializer {
        public ScriptFile {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String describe() {
            return "file:" + path;
        }
    }

    record OpsBatch(List<TxOp> ops) implements Initializer {
        public OpsBatch {
            ops = ops == null ? List.of() : List.copyOf(ops);
        }

        @Override
        public String describe() {
            return "ops:" + ops.size();
        }
    }

    /** Literal script text; blank text is a no-op. */
    record InlineScript(String source) implements Initializer {
        public boolean isEmpty() {
            return source == null || source.isBlank();
        }

        @Override
        public String describe() {
            return isEmpty() ? "script:<empty>" : "script:" + source.length() + " chars";
        }
    }

    static Initializer function(String reference) {
        return new NamedFunction(reference);
    }

    static Initializer module(String moduleId) {
        return new ModuleReference(moduleId);
    }

    static Initializer file(Path path) {
        return new ScriptFile(path);
    }

    static Initializer ops(List<TxOp> ops) {
        return new OpsBatch(ops);
    }

    /** Ops batch from raw tx data (lists and maps as read from JSON/YAML). */
    static Initializer opsData(Object raw) {
        return new OpsBatch(TxData.parse(raw));
    }

    static Initializer script(String source) {
        return new InlineScript(source);
    }

    /**
     * Parses the textual initializer syntax used on the command line and in workspace files:
     * {@code fn:pkg.Class#method}, {@code module:id}, {@code file:path}, {@code ops:path}
     * (YAML/JSON tx data) or {@code script:source}. Relative paths resolve against {@code baseDir}.
     */
    static Initializer parse(String text, Path baseDir) {
        if (text == null) {
            throw new IllegalArgumentException("initializer must not be null");
        }
        int colon = text.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Initializer must be prefixed with fn:, module:, file:, ops: or script: (got '" + text + "')");
        }
        String kind = text.substring(0, colon);
        String value = text.substring(colon + 1);
        switch (kind) {
            case "fn":
                return new NamedFunction(value.trim());
            case "module":
                return new ModuleReference(value.trim());
            case "file":
                return new ScriptFile(resolve(baseDir, value.trim()));
            case "ops":
                return new OpsBatch(TxDataLoader.load(resolve(baseDir, value.trim())));
            case "script":
                return new InlineScript(value);
            default:
                throw new IllegalArgumentException("Unknown initializer kind '" + kind + "' in '" + text + "'");
        }
    }

    static Initializer parse(String text) {
        return parse(text, null);
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        return baseDir.resolve(path).normalize();
    }
}
