package work.arachne.config.error;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Raised by a DSL form before its body runs when the supplied arguments do not match its declared shape.
 */
public final class ArgumentValidationException extends ConfigScriptException {
    public ArgumentValidationException(String dslFunction, List<Object> args, List<String> problems, String signature) {
        super(ConfigErrors.INVALID_DSL_ARGS, data(dslFunction, args, problems, signature));
    }

    private static LinkedHashMap<String, Object> data(String dslFunction, List<Object> args, List<String> problems, String signature) {
        var data = new LinkedHashMap<String, Object>();
        data.put("dsl-fn", dslFunction);
        data.put("args", args == null ? List.of() : new ArrayList<>(args));
        data.put("problems", problems == null ? List.of() : List.copyOf(problems));
        data.put("signature", signature);
        return data;
    }

    public String dslFunction() {
        return (String) data("dsl-fn");
    }

    @SuppressWarnings("unchecked")
    public List<Object> args() {
        return (List<Object>) data("args");
    }

    @SuppressWarnings("unchecked")
    public List<String> problems() {
        return (List<String>) data("problems");
    }
}
