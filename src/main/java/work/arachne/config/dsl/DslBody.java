package work.arachne.config.dsl;

/**
 * Body of a DSL form. Runs with the config scope of the calling script in context.
 */
@FunctionalInterface
public interface DslBody {
    Object apply(DslArgs args);
}
