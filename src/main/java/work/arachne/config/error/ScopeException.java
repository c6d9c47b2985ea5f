package work.arachne.config.error;

import java.util.Map;

/**
 * Raised when a scope-dependent operation runs with no active config scope.
 */
public final class ScopeException extends ConfigScriptException {
    public ScopeException() {
        super(ConfigErrors.CONTEXT_CONFIG_OUTSIDE_OF_SCRIPT, Map.of());
    }
}
