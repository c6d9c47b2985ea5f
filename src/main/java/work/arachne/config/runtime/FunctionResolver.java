package work.arachne.config.runtime;

import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import work.arachne.config.error.UnresolvedFunctionException;
import work.arachne.config.store.ConfigGraph;

/**
 * Looks up the function named by a {@link Initializer.NamedFunction}.
 */
@FunctionalInterface
public interface FunctionResolver {
    Optional<UnaryOperator<ConfigGraph>> find(String reference);

    default UnaryOperator<ConfigGraph> resolve(String reference) {
        return find(reference).orElseThrow(() -> new UnresolvedFunctionException(
            reference, "No function is registered under this name", null));
    }

    default FunctionResolver orElse(FunctionResolver fallback) {
        FunctionResolver primary = this;
        return new FunctionResolver() {
            @Override
            public Optional<UnaryOperator<ConfigGraph>> find(String reference) {
                Optional<UnaryOperator<ConfigGraph>> found = primary.find(reference);
                return found.isPresent() ? found : fallback.find(reference);
            }

            @Override
            public UnaryOperator<ConfigGraph> resolve(String reference) {
                Optional<UnaryOperator<ConfigGraph>> found = primary.find(reference);
                return found.isPresent() ? found.get() : fallback.resolve(reference);
            }
        };
    }

    static FunctionResolver of(Map<String, UnaryOperator<ConfigGraph>> functions) {
        Map<String, UnaryOperator<ConfigGraph>> copy = Map.copyOf(functions);
        return reference -> Optional.ofNullable(copy.get(reference));
    }
}
