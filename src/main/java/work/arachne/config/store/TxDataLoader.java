package work.arachne.config.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads transaction data from YAML or JSON files (JSON being a subset of YAML).
 */
public final class TxDataLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private TxDataLoader() {}

    public static List<TxOp> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            Object raw = YAML_MAPPER.readValue(in, Object.class);
            return TxData.parse(raw);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read transaction data: " + path, ex);
        }
    }

    public static List<TxOp> parse(String text) {
        try {
            return TxData.parse(YAML_MAPPER.readValue(text, Object.class));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid transaction data: " + ex.getMessage(), ex);
        }
    }
}
