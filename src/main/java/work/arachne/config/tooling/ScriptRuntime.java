package work.arachne.config.tooling;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.arachne.config.dsl.DslRegistry;
import work.arachne.config.dsl.ScriptFrames;
import work.arachne.config.error.ConfigScriptException;
import work.arachne.config.error.ScriptEvaluationException;

/**
 * Evaluates config scripts (JavaScript via GraalVM) in fresh, uniquely named namespaces.
 *
 * <p>Each evaluation wraps the source in its own function scope and sees these bindings:
 * {@code dsl} (registered DSL forms), {@code config} ({@link ScriptApi}), {@code require},
 * {@code module} and {@code exports}. The underlying polyglot context is created on first use and
 * is confined to the thread that builds the configuration.
 */
public final class ScriptRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScriptRuntime.class);
    private static final AtomicLong COUNTER = new AtomicLong();
    private static final String WRAPPER_HEAD = "(function(dsl, config, require, module, exports) {\"use strict\";";
    private static final String WRAPPER_TAIL = "\n})";

    private final DslRegistry registry;
    private final Set<String> retainedGlobals = new HashSet<>();
    private Context context;
    private Value dslValue;

    public ScriptRuntime(DslRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Allocates a namespace name that is unique within this process and across processes.
     */
    public static String newNamespaceName(String hint) {
        String sanitized = hint == null || hint.isBlank()
            ? "inline"
            : hint.replaceAll("[^A-Za-z0-9_.-]", "_");
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return ScriptFrames.NAMESPACE_PREFIX + "-" + sanitized + "-" + COUNTER.incrementAndGet() + "-" + suffix;
    }

    public ScriptNamespace evaluateFile(Path path, ModuleRequirer requirer) throws IOException {
        String source = Files.readString(path, StandardCharsets.UTF_8);
        String hint = path.getFileName() == null ? "file" : path.getFileName().toString();
        return evaluate(source, hint, path.toAbsolutePath().normalize().toString(), requirer);
    }

    public ScriptNamespace evaluate(String source, String hint, String origin, ModuleRequirer requirer) {
        String namespace = newNamespaceName(hint);
        log.atTrace()
            .addKeyValue("namespace", namespace)
            .addKeyValue("origin", origin)
            .log("Creating script namespace");
        Context polyglot = context();
        Source wrapped = Source.newBuilder("js", WRAPPER_HEAD + source + WRAPPER_TAIL, namespace + ".js").buildLiteral();
        ModuleRequirer effective = requirer == null ? ModuleRequirer.NONE : requirer;
        try {
            Value function = polyglot.eval(wrapped);
            Value module = polyglot.eval("js", "({ exports: {} })");
            ProxyExecutable require = args -> {
                if (args.length == 0 || !args[0].isString()) {
                    throw new IllegalArgumentException("require expects a module identifier");
                }
                return effective.require(args[0].asString());
            };
            function.execute(dslValue, polyglot.asValue(new ScriptApi(namespace)), require, module, module.getMember("exports"));
            return new ScriptNamespace(namespace, origin, module.getMember("exports"));
        } catch (PolyglotException ex) {
            throw translate(ex, namespace, origin);
        }
    }

    /**
     * Own keys of the global object shared by every namespace of this runtime.
     */
    public Set<String> globalKeys() {
        return new HashSet<>(context().getBindings("js").getMemberKeys());
    }

    /**
     * Keeps {@code keys} across {@link #resetGlobals()}; used for globals defined by library modules.
     */
    public void retainGlobals(Collection<String> keys) {
        retainedGlobals.addAll(keys);
    }

    /**
     * Deletes every global defined since the context was created, except retained ones, and returns
     * the number of globals removed.
     */
    public int resetGlobals() {
        if (context == null) {
            return 0;
        }
        Value bindings = context.getBindings("js");
        int removed = 0;
        for (String key : new ArrayList<>(bindings.getMemberKeys())) {
            if (retainedGlobals.contains(key)) {
                continue;
            }
            try {
                if (bindings.removeMember(key)) {
                    removed++;
                }
            } catch (UnsupportedOperationException ex) {
                log.atWarn().addKeyValue("global", key).log("Script global cannot be removed: {}", ex.getMessage());
            }
        }
        if (removed > 0) {
            log.atTrace().addKeyValue("removed", removed).log("Reset script globals");
        }
        return removed;
    }

    private static RuntimeException translate(PolyglotException ex, String namespace, String origin) {
        if (ex.isHostException()) {
            Throwable host = ex.asHostException();
            if (host instanceof ConfigScriptException error) {
                if (error.scriptTrace().isEmpty()) {
                    List<StackTraceElement> frames = error.provenance() != null
                        ? error.provenance().scriptFrames(ex.getStackTrace())
                        : ScriptFrames.filter(ex.getStackTrace(), ScriptFrames::isScriptFrame);
                    error.withScriptTrace(frames);
                }
                return error;
            }
            if (host instanceof RuntimeException runtime) {
                return runtime;
            }
            return new ScriptEvaluationException(namespace, origin, String.valueOf(host), frames(ex), host);
        }
        return new ScriptEvaluationException(namespace, origin, ex.getMessage(), frames(ex), ex);
    }

    private static List<StackTraceElement> frames(PolyglotException ex) {
        return ScriptFrames.filter(ex.getStackTrace(), ScriptFrames::isScriptFrame);
    }

    private Context context() {
        if (context == null) {
            context = Context
                .newBuilder("js")
                .allowHostAccess(HostAccess.ALL)
                .allowExperimentalOptions(true)
                .allowAllAccess(true)
                .option("engine.WarnInterpreterOnly", "false")
                .option("js.ecmascript-version", "2023")
                .build();
            dslValue = context.asValue(new DslBindings(registry));
            injectConsoleGlobal(context);
            retainedGlobals.addAll(context.getBindings("js").getMemberKeys());
        }
        return context;
    }

    private static void injectConsoleGlobal(Context context) {
        Value bindings = context.getBindings("js");
        Value console = context.eval("js", "({})");
        console.putMember("log", createConsoleFunction("info"));
        console.putMember("info", createConsoleFunction("info"));
        console.putMember("warn", createConsoleFunction("warn"));
        console.putMember("error", createConsoleFunction("error"));
        console.putMember("debug", createConsoleFunction("debug"));
        console.putMember("trace", createConsoleFunction("trace"));
        bindings.putMember("console", console);
    }

    private static ProxyExecutable createConsoleFunction(String level) {
        return args -> {
            String rendered = ScriptValues.render(args);
            switch (level) {
                case "warn" -> log.warn(rendered);
                case "error" -> log.error(rendered);
                case "debug" -> log.debug(rendered);
                case "trace" -> log.trace(rendered);
                default -> log.info(rendered);
            }
            return null;
        };
    }

    @Override
    public void close() {
        if (context != null) {
            context.close();
            context = null;
            dslValue = null;
            retainedGlobals.clear();
        }
    }
}
