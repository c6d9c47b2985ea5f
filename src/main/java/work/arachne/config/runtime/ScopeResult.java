package work.arachne.config.runtime;

import work.arachne.config.store.ConfigGraph;

/**
 * Value returned by a scope body together with the graph the scope held when the body finished.
 */
public record ScopeResult<T>(T value, ConfigGraph graph) {}
