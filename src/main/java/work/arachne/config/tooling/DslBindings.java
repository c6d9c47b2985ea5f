package work.arachne.config.tooling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;
import work.arachne.config.dsl.DslFunction;
import work.arachne.config.dsl.DslRegistry;

/**
 * The {@code dsl} object seen by scripts: every registered form as a callable member, plus
 * {@code dsl.call(name, ...args)} for qualified names.
 */
final class DslBindings implements ProxyObject {
    private static final String CALL = "call";

    private final DslRegistry registry;

    DslBindings(DslRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Object getMember(String key) {
        if (CALL.equals(key)) {
            return (ProxyExecutable) args -> {
                if (args.length == 0 || !args[0].isString()) {
                    throw new IllegalArgumentException("dsl.call expects the name of a DSL form as first argument");
                }
                DslFunction fn = registry.require(args[0].asString());
                return fn.invoke(ScriptValues.toJava(Arrays.copyOfRange(args, 1, args.length)));
            };
        }
        DslFunction fn = registry.get(key);
        if (fn == null) {
            return null;
        }
        return (ProxyExecutable) args -> fn.invoke(ScriptValues.toJava(args));
    }

    @Override
    public Object getMemberKeys() {
        List<Object> keys = new ArrayList<>(registry.names());
        keys.add(CALL);
        return ProxyArray.fromList(keys);
    }

    @Override
    public boolean hasMember(String key) {
        return CALL.equals(key) || registry.get(key) != null;
    }

    @Override
    public void putMember(String key, Value value) {
        throw new UnsupportedOperationException("dsl forms are registered from Java, not from scripts");
    }
}
