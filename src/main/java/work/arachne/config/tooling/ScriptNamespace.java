package work.arachne.config.tooling;

import org.graalvm.polyglot.Value;

/**
 * A completed script evaluation: the unique namespace name it ran under, where its source came from
 * and the {@code module.exports} value it left behind.
 */
public record ScriptNamespace(String name, String origin, Value exports) {}
