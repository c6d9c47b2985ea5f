package work.arachne.config.tooling;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Value;

/**
 * Conversion of guest values into plain Java values (maps, lists, boxed scalars, host objects).
 */
final class ScriptValues {
    private ScriptValues() {}

    static Object toJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isHostObject()) {
            return value.asHostObject();
        }
        if (value.isProxyObject()) {
            return value.asProxyObject();
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toJava(value.getArrayElement(i)));
            }
            return list;
        }
        if (value.canExecute()) {
            return value;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toJava(value.getMember(key)));
            }
            return map;
        }
        return value.toString();
    }

    static List<Object> toJava(Value[] values) {
        List<Object> converted = new ArrayList<>(values == null ? 0 : values.length);
        if (values != null) {
            for (Value value : values) {
                converted.add(toJava(value));
            }
        }
        return converted;
    }

    static String render(Value[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            Object value = toJava(args[i]);
            if (i > 0) {
                builder.append(' ');
            }
            builder.append(value == null ? "null" : String.valueOf(value));
        }
        return builder.toString();
    }
}
