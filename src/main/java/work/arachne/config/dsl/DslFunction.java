package work.arachne.config.dsl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import work.arachne.config.error.ConfigScriptException;

/**
 * A user-facing DSL form. Every invocation validates the arguments against the declared
 * {@link ArgSpec} before anything else happens, then runs the body under a {@link Provenance}
 * naming this form.
 */
public final class DslFunction {
    private final String name;
    private final String doc;
    private final ArgSpec spec;
    private final DslBody body;
    private final Predicate<StackTraceElement> stackFilter;

    private DslFunction(String name, String doc, ArgSpec spec, DslBody body, Predicate<StackTraceElement> stackFilter) {
        this.name = name;
        this.doc = doc == null ? "" : doc;
        this.spec = spec == null ? ArgSpec.none() : spec;
        this.body = Objects.requireNonNull(body, "body");
        this.stackFilter = stackFilter == null ? ScriptFrames::isScriptFrame : stackFilter;
    }

    public static DslFunction define(String qualifiedName, String doc, ArgSpec spec, DslBody body) {
        return define(qualifiedName, doc, spec, body, ScriptFrames::isScriptFrame);
    }

    public static DslFunction define(
        String qualifiedName,
        String doc,
        ArgSpec spec,
        DslBody body,
        Predicate<StackTraceElement> stackFilter
    ) {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        int slash = qualifiedName.indexOf('/');
        if (slash <= 0 || slash == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("DSL form names must be qualified as namespace/name: " + qualifiedName);
        }
        return new DslFunction(qualifiedName, doc, spec, body, stackFilter);
    }

    public String name() {
        return name;
    }

    public String simpleName() {
        return name.substring(name.indexOf('/') + 1);
    }

    public String doc() {
        return doc;
    }

    public ArgSpec spec() {
        return spec;
    }

    public Object invoke(Object... args) {
        return invoke(args == null ? List.of() : Arrays.asList(args));
    }

    public Object invoke(List<Object> args) {
        List<Object> raw = args == null ? new ArrayList<>() : new ArrayList<>(args);
        Provenance provenance = new Provenance(name, raw, stackFilter);
        try {
            DslArgs conformed = spec.conform(name, raw);
            return Provenance.with(provenance, () -> body.apply(conformed));
        } catch (ConfigScriptException ex) {
            throw ex.withProvenance(provenance);
        }
    }

    @Override
    public String toString() {
        return name + " " + spec.signature();
    }
}
