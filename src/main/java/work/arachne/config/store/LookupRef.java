package work.arachne.config.store;

import java.util.Objects;
import work.arachne.config.shared.Values;

/**
 * Identifies an entity by the value of one of its attributes.
 */
public record LookupRef(String attribute, Object value) {
    public LookupRef {
        Objects.requireNonNull(attribute, "attribute");
        value = Values.normalize(value);
    }

    public static LookupRef aid(String aid) {
        return new LookupRef(ConfigGraph.AID, aid);
    }

    @Override
    public String toString() {
        return "[" + attribute + " " + value + "]";
    }
}
