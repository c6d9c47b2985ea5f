package work.arachne.config.tooling;

import org.graalvm.polyglot.Value;

/**
 * Resolves {@code require(id)} calls made by scripts to the exports of the named module.
 */
@FunctionalInterface
public interface ModuleRequirer {
    ModuleRequirer NONE = moduleId -> {
        throw new IllegalStateException("require is unavailable in this context: " + moduleId);
    };

    Value require(String moduleId);
}
