package work.arachne.config.dsl;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import work.arachne.config.store.EntityRef;

/**
 * Named predicate describing what a single DSL argument may be.
 */
public record ArgType(String name, Predicate<Object> test) {
    public static final ArgType ANY = new ArgType("any", Objects::nonNull);
    public static final ArgType STRING = new ArgType("string", v -> v instanceof String);
    public static final ArgType AID = new ArgType("arachne-id", v -> v instanceof String s && !s.isBlank());
    public static final ArgType NUMBER = new ArgType("number", v -> v instanceof Number);
    public static final ArgType INTEGER = new ArgType("integer",
        v -> v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte);
    public static final ArgType BOOLEAN = new ArgType("boolean", v -> v instanceof Boolean);
    public static final ArgType MAP = new ArgType("map", v -> v instanceof Map<?, ?>);
    public static final ArgType LIST = new ArgType("list", v -> v instanceof List<?>);
    public static final ArgType ENTITY_REF = new ArgType("entity-ref", v -> v instanceof EntityRef);

    public ArgType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(test, "test");
    }

    public boolean accepts(Object value) {
        return test.test(value);
    }

    public static ArgType oneOf(ArgType... types) {
        List<ArgType> options = List.of(types);
        String name = options.stream().map(ArgType::name).collect(Collectors.joining("|"));
        return new ArgType(name, v -> options.stream().anyMatch(t -> t.accepts(v)));
    }

    public static ArgType listOf(ArgType element) {
        return new ArgType("list<" + element.name() + ">",
            v -> v instanceof List<?> list && list.stream().allMatch(element::accepts));
    }

    public static ArgType enumOf(String... values) {
        List<String> allowed = Arrays.asList(values);
        return new ArgType(String.join("|", allowed), v -> v instanceof String s && allowed.contains(s));
    }
}
