package work.arachne.config.dsl;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import work.arachne.config.error.ConfigErrors;
import work.arachne.config.error.ConfigScriptException;

/**
 * Stores DSL forms by qualified name. Forms are also reachable by their simple name as long as no
 * two registered forms share it.
 */
public final class DslRegistry {
    private final Map<String, DslFunction> functions = new ConcurrentHashMap<>();
    private final Map<String, String> simpleNames = new ConcurrentHashMap<>();
    private final Set<String> ambiguous = ConcurrentHashMap.newKeySet();

    public static DslRegistry withCoreForms() {
        return CoreDsl.register(new DslRegistry());
    }

    public DslRegistry register(DslFunction fn) {
        functions.put(fn.name(), fn);
        String simple = fn.simpleName();
        if (ambiguous.contains(simple)) {
            return this;
        }
        String existing = simpleNames.putIfAbsent(simple, fn.name());
        if (existing != null && !existing.equals(fn.name())) {
            simpleNames.remove(simple);
            ambiguous.add(simple);
        }
        return this;
    }

    public DslFunction get(String name) {
        if (name == null) {
            return null;
        }
        DslFunction fn = functions.get(name);
        if (fn != null) {
            return fn;
        }
        String qualified = simpleNames.get(name);
        return qualified == null ? null : functions.get(qualified);
    }

    public DslFunction require(String name) {
        DslFunction fn = get(name);
        if (fn == null) {
            throw new ConfigScriptException(ConfigErrors.UNKNOWN_DSL_FUNCTION, Map.of("dsl-fn", String.valueOf(name)));
        }
        return fn;
    }

    public Object invoke(String name, List<Object> args) {
        return require(name).invoke(args);
    }

    public void unregister(String name) {
        DslFunction fn = functions.remove(name);
        if (fn == null) {
            return;
        }
        String simple = fn.simpleName();
        simpleNames.remove(simple);
        ambiguous.remove(simple);
        List<String> sharing = functions.values().stream()
            .filter(other -> other.simpleName().equals(simple))
            .map(DslFunction::name)
            .toList();
        if (sharing.size() == 1) {
            simpleNames.put(simple, sharing.get(0));
        } else if (sharing.size() > 1) {
            ambiguous.add(simple);
        }
    }

    /**
     * Names under which forms are reachable: every qualified name plus unambiguous simple names.
     */
    public Set<String> names() {
        Set<String> names = new TreeSet<>(functions.keySet());
        names.addAll(simpleNames.keySet());
        return Collections.unmodifiableSet(names);
    }

    public Map<String, DslFunction> entries() {
        return Collections.unmodifiableMap(functions);
    }
}
