package work.arachne.config.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.arachne.config.dsl.Provenance;

/**
 * Base exception for every failure raised while building a configuration. Carries the
 * {@link ErrorDefinition} it was raised from and the structured data describing the failure.
 */
public class ConfigScriptException extends RuntimeException {
    private final ErrorDefinition definition;
    private final Map<String, Object> data;
    private Provenance provenance;
    private List<StackTraceElement> scriptTrace = List.of();

    public ConfigScriptException(ErrorDefinition definition, Map<String, Object> data) {
        this(definition, data, null);
    }

    public ConfigScriptException(ErrorDefinition definition, Map<String, Object> data, Throwable cause) {
        super(Objects.requireNonNull(definition, "definition").renderMessage(data), cause);
        this.definition = definition;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public String code() {
        return definition.code();
    }

    public ErrorDefinition definition() {
        return definition;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Object data(String key) {
        return data.get(key);
    }

    public Provenance provenance() {
        return provenance;
    }

    /**
     * Records the DSL invocation this error escaped from. The first recorded provenance wins, so the
     * innermost DSL call is reported when invocations are nested.
     */
    public ConfigScriptException withProvenance(Provenance provenance) {
        if (this.provenance == null) {
            this.provenance = provenance;
        }
        return this;
    }

    public List<StackTraceElement> scriptTrace() {
        return scriptTrace;
    }

    public ConfigScriptException withScriptTrace(List<StackTraceElement> frames) {
        this.scriptTrace = frames == null ? List.of() : List.copyOf(frames);
        return this;
    }

    /**
     * Human readable rendering: message, explanation, suggestions and script frames.
     */
    public String explain() {
        StringBuilder out = new StringBuilder();
        out.append(getMessage());
        String explanation = definition.renderExplanation(data);
        if (!explanation.isBlank()) {
            out.append(System.lineSeparator()).append(System.lineSeparator()).append(explanation);
        }
        List<String> suggestions = definition.renderSuggestions(data);
        if (!suggestions.isEmpty()) {
            out.append(System.lineSeparator()).append(System.lineSeparator()).append("Suggestions:");
            int index = 1;
            for (String suggestion : suggestions) {
                out.append(System.lineSeparator()).append("  ").append(index++).append(". ").append(suggestion);
            }
        }
        if (provenance != null) {
            out.append(System.lineSeparator()).append(System.lineSeparator())
                .append("While evaluating DSL form: ").append(provenance.function());
        }
        if (!scriptTrace.isEmpty()) {
            out.append(System.lineSeparator()).append("Script frames:");
            for (StackTraceElement frame : scriptTrace) {
                out.append(System.lineSeparator()).append("  at ").append(frame);
            }
        }
        return out.toString();
    }
}
