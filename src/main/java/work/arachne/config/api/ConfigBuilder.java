package work.arachne.config.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.arachne.config.error.ConfigScriptException;
import work.arachne.config.runtime.ConfigEngine;
import work.arachne.config.runtime.Initializer;
import work.arachne.config.store.ConfigGraph;

/**
 * Public entry point for embedding the configuration builder.
 */
public final class ConfigBuilder {
    private static final Logger log = LoggerFactory.getLogger(ConfigBuilder.class);

    public BuildResult build(ConfigBuildConfiguration configuration) {
        var started = Instant.now();
        var initializers = describe(configuration.initializers());
        try (ConfigEngine engine = ConfigEngine.builder().moduleRoots(configuration.moduleRoots()).build()) {
            ConfigGraph graph = engine.build(configuration.initializers());

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("initializers", initializers);
            metadata.put("moduleRoots", configuration.moduleRoots().stream().map(Object::toString).toList());
            metadata.put("entities", graph.size());
            metadata.put("transactions", graph.history().size());
            metadata.put("logLevel", configuration.logLevel().name());
            return BuildResult.success(graph, metadata, started);
        } catch (Exception ex) {
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("initializers", initializers);
            errorMeta.put("error", message);
            if (ex instanceof ConfigScriptException configError) {
                errorMeta.put("code", configError.code());
                if (!configError.scriptTrace().isEmpty()) {
                    errorMeta.put("scriptTrace", configError.scriptTrace().stream().map(Object::toString).toList());
                }
            }
            log.atWarn()
                .addKeyValue("initializers", initializers.size())
                .addKeyValue("error", ex.getClass().getSimpleName())
                .log("Configuration build failed: {}", message);
            if (Boolean.getBoolean("arachne.debug")) {
                ex.printStackTrace();
            }
            return BuildResult.failure(message, errorMeta, started);
        }
    }

    private static List<String> describe(List<Initializer> initializers) {
        List<String> out = new ArrayList<>(initializers.size());
        for (Initializer initializer : initializers) {
            out.add(initializer.describe());
        }
        return out;
    }
}
