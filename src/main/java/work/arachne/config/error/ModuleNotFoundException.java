package work.arachne.config.error;

import java.util.Map;

public final class ModuleNotFoundException extends ConfigScriptException {
    public ModuleNotFoundException(String moduleId) {
        super(ConfigErrors.CONFIG_MODULE_NOT_FOUND, Map.of("module", moduleId));
    }

    public String moduleId() {
        return (String) data("module");
    }
}
