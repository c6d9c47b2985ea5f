package work.arachne.config.error;

import java.util.Map;

public final class UnresolvedFunctionException extends ConfigScriptException {
    public UnresolvedFunctionException(String reference, String reason, Throwable cause) {
        super(ConfigErrors.UNRESOLVED_FUNCTION, Map.of("function", reference, "reason", reason), cause);
    }
}
