package work.arachne.config.runtime;

/**
 * Work executed while a {@link ConfigScope} is active.
 */
@FunctionalInterface
public interface ScopeBody<T> {
    T run() throws Exception;
}
