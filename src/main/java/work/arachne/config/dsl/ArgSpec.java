package work.arachne.config.dsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.arachne.config.error.ArgumentValidationException;
import work.arachne.config.shared.Values;

/**
 * Declared positional argument shape of a DSL form: required parameters, then optional ones, then
 * an optional variadic tail.
 */
public final class ArgSpec {
    private static final ArgSpec NONE = new ArgSpec(List.of(), null);

    private final List<Param> params;
    private final Param rest;
    private final int required;

    private ArgSpec(List<Param> params, Param rest) {
        this.params = List.copyOf(params);
        this.rest = rest;
        this.required = (int) params.stream().filter(p -> !p.optional()).count();
    }

    public static ArgSpec none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Param> params() {
        return params;
    }

    public Param rest() {
        return rest;
    }

    /**
     * Lists every way in which {@code args} fails to match; empty when the arguments conform.
     */
    public List<String> problems(List<Object> args) {
        List<String> problems = new ArrayList<>();
        int count = args.size();
        if (count < required) {
            for (int i = count; i < required; i++) {
                problems.add("missing argument " + params.get(i).name());
            }
        }
        if (rest == null && count > params.size()) {
            problems.add("expected at most " + params.size() + " arguments, got " + count);
        }
        for (int i = 0; i < Math.min(count, params.size()); i++) {
            Param param = params.get(i);
            Object value = args.get(i);
            if (value == null && param.optional()) {
                continue;
            }
            if (!param.type().accepts(value)) {
                problems.add(param.name() + " must be " + param.type().name() + " but was " + Values.describe(value));
            }
        }
        if (rest != null) {
            for (int i = params.size(); i < count; i++) {
                Object value = args.get(i);
                if (!rest.type().accepts(value)) {
                    problems.add(rest.name() + "[" + (i - params.size()) + "] must be " + rest.type().name()
                        + " but was " + Values.describe(value));
                }
            }
        }
        return problems;
    }

    /**
     * Validates {@code args} and binds them to parameter names.
     *
     * @throws ArgumentValidationException when the arguments do not conform
     */
    public DslArgs conform(String dslFunction, List<Object> args) {
        List<String> problems = problems(args);
        if (!problems.isEmpty()) {
            throw new ArgumentValidationException(dslFunction, args, problems, signature());
        }
        Map<String, Object> named = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            Object value = i < args.size() ? args.get(i) : null;
            if (value != null) {
                named.put(params.get(i).name(), value);
            }
        }
        if (rest != null) {
            List<Object> tail = args.size() > params.size()
                ? new ArrayList<>(args.subList(params.size(), args.size()))
                : new ArrayList<>();
            named.put(rest.name(), tail);
        }
        return new DslArgs(named, args);
    }

    public String signature() {
        List<String> parts = new ArrayList<>();
        for (Param param : params) {
            parts.add(param.name() + (param.optional() ? "?" : "") + ":" + param.type().name());
        }
        if (rest != null) {
            parts.add("& " + rest.name() + ":" + rest.type().name());
        }
        return "[" + String.join(" ", parts) + "]";
    }

    @Override
    public String toString() {
        return signature();
    }

    public record Param(String name, ArgType type, boolean optional) {
        public Param {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    public static final class Builder {
        private final List<Param> params = new ArrayList<>();
        private Param rest;

        public Builder required(String name, ArgType type) {
            if (params.stream().anyMatch(Param::optional)) {
                throw new IllegalStateException("required parameter " + name + " cannot follow optional parameters");
            }
            return add(new Param(name, type, false));
        }

        public Builder optional(String name, ArgType type) {
            return add(new Param(name, type, true));
        }

        public Builder rest(String name, ArgType type) {
            if (rest != null) {
                throw new IllegalStateException("only one rest parameter is allowed");
            }
            this.rest = new Param(name, type, true);
            return this;
        }

        private Builder add(Param param) {
            if (rest != null) {
                throw new IllegalStateException("parameter " + param.name() + " cannot follow the rest parameter");
            }
            if (params.stream().anyMatch(p -> p.name().equals(param.name()))) {
                throw new IllegalStateException("duplicate parameter " + param.name());
            }
            params.add(param);
            return this;
        }

        public ArgSpec build() {
            return new ArgSpec(params, rest);
        }
    }
}
