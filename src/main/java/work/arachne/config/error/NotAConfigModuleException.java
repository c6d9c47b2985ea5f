package work.arachne.config.error;

import java.util.Map;

public final class NotAConfigModuleException extends ConfigScriptException {
    public NotAConfigModuleException(String moduleId) {
        super(ConfigErrors.NOT_A_CONFIG_MODULE, Map.of("module", moduleId));
    }

    public String moduleId() {
        return (String) data("module");
    }
}
