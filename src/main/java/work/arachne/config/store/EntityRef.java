package work.arachne.config.store;

/**
 * Reference to an entity of a {@link ConfigGraph}.
 */
public record EntityRef(long id) implements Comparable<EntityRef> {
    @Override
    public int compareTo(EntityRef other) {
        return Long.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "#" + id;
    }
}
