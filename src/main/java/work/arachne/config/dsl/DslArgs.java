package work.arachne.config.dsl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arguments of a DSL invocation after conforming them to the form's {@link ArgSpec}.
 */
public final class DslArgs {
    private final Map<String, Object> named;
    private final List<Object> raw;

    DslArgs(Map<String, Object> named, List<Object> raw) {
        this.named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
        this.raw = Collections.unmodifiableList(raw);
    }

    public boolean has(String name) {
        return named.containsKey(name);
    }

    public Object get(String name) {
        return named.get(name);
    }

    public <T> Optional<T> optional(String name, Class<T> type) {
        Object value = named.get(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public String string(String name) {
        return (String) named.get(name);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String name) {
        Object value = named.get(name);
        return value == null ? Map.of() : (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(String name) {
        Object value = named.get(name);
        return value == null ? List.of() : (List<Object>) value;
    }

    public Map<String, Object> asMap() {
        return named;
    }

    public List<Object> raw() {
        return raw;
    }
}
