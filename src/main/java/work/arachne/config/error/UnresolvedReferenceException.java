package work.arachne.config.error;

import java.util.LinkedHashMap;
import work.arachne.config.store.ConfigGraph;

/**
 * Raised when an Arachne ID does not name any entity of the config in context.
 */
public final class UnresolvedReferenceException extends ConfigScriptException {
    public UnresolvedReferenceException(ConfigGraph graph, String aid, String dslFunction) {
        super(ConfigErrors.NONEXISTENT_AID, data(graph, aid, dslFunction));
    }

    private static LinkedHashMap<String, Object> data(ConfigGraph graph, String aid, String dslFunction) {
        var data = new LinkedHashMap<String, Object>();
        data.put("cfg", graph);
        data.put("aid", aid);
        data.put("dsl-fn", dslFunction);
        return data;
    }

    public ConfigGraph graph() {
        return (ConfigGraph) data("cfg");
    }

    public String aid() {
        return (String) data("aid");
    }

    public String dslFunction() {
        return (String) data("dsl-fn");
    }
}
