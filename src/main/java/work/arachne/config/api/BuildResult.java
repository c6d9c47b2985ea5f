package work.arachne.config.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.arachne.config.store.ConfigGraph;

/**
 * Outcome of a {@link ConfigBuilder} run (usable by the CLI and embedding apps).
 */
public record BuildResult(
    Status status,
    Map<String, Object> metadata,
    Optional<ConfigGraph> graph,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public BuildResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static BuildResult success(ConfigGraph graph, Map<String, Object> metadata, Instant startedAt) {
        return new BuildResult(Status.SUCCESS, metadata, Optional.of(graph), startedAt, Instant.now());
    }

    public static BuildResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new BuildResult(Status.FAILURE, meta, Optional.empty(), startedAt, Instant.now());
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        graph.ifPresent(g -> serializable.put("graph", g.toSerializableMap()));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
