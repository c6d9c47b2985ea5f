package work.arachne.config.error;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Wraps an error raised by guest script code (as opposed to a DSL form or the engine itself).
 */
public final class ScriptEvaluationException extends ConfigScriptException {
    public ScriptEvaluationException(String namespace, String origin, String cause, List<StackTraceElement> frames, Throwable error) {
        super(ConfigErrors.SCRIPT_EVALUATION_FAILED, data(namespace, origin, cause), error);
        withScriptTrace(frames);
    }

    private static LinkedHashMap<String, Object> data(String namespace, String origin, String cause) {
        var data = new LinkedHashMap<String, Object>();
        data.put("namespace", namespace);
        data.put("origin", origin);
        data.put("cause", cause == null ? "unknown error" : cause);
        return data;
    }

    public String namespace() {
        return (String) data("namespace");
    }
}
