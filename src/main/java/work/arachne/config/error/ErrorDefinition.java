package work.arachne.config.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static description of an error kind: a stable code, a message template, and the prose used to
 * explain the failure to a script author.
 *
 * <p>Message and explanation templates may reference entries of the error data as {@code :key};
 * placeholders without a matching entry are left untouched.
 */
public record ErrorDefinition(
    String code,
    String message,
    String explanation,
    List<String> suggestions,
    Map<String, String> dataDocs
) {
    private static final Pattern PLACEHOLDER = Pattern.compile(":([a-zA-Z][a-zA-Z0-9-]*)");

    public ErrorDefinition {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        explanation = explanation == null ? "" : explanation;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        dataDocs = dataDocs == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(dataDocs));
    }

    public String renderMessage(Map<String, Object> data) {
        return render(message, data);
    }

    public String renderExplanation(Map<String, Object> data) {
        return render(explanation, data);
    }

    public List<String> renderSuggestions(Map<String, Object> data) {
        return suggestions.stream().map(s -> render(s, data)).toList();
    }

    static String render(String template, Map<String, Object> data) {
        if (template == null || template.isEmpty() || data == null || data.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = data.containsKey(key)
                ? String.valueOf(data.get(key))
                : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
