package work.arachne.config.store;

import java.util.Objects;

/**
 * Caller-chosen placeholder for an entity that only receives a real {@link EntityRef} once the
 * transaction creating it has been applied.
 */
public record TempId(String name) {
    public TempId {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("tempid name must not be blank");
        }
    }

    public static TempId of(String name) {
        return new TempId(name);
    }

    @Override
    public String toString() {
        return "tempid:" + name;
    }
}
