package work.arachne.config.error;

import java.util.List;
import java.util.Map;

/**
 * Catalogue of the error kinds raised by the configuration script engine.
 */
public final class ConfigErrors {
    private ConfigErrors() {}

    public static final ErrorDefinition CONTEXT_CONFIG_OUTSIDE_OF_SCRIPT = new ErrorDefinition(
        "context-config-outside-of-script",
        "Cannot reference context config in non-script context",
        "You attempted to use one of the script-building DSL forms, but you are not currently in the context "
            + "of a config initialization script. The DSL forms work by imperatively updating a configuration "
            + "that is currently \"in context\"; it is not meaningful to call them on their own.",
        List.of("Use this DSL form only inside a config initialization script, such as one passed to "
            + "ConfigEngine.apply or ConfigEngine.build."),
        Map.of()
    );

    public static final ErrorDefinition NONEXISTENT_AID = new ErrorDefinition(
        "nonexistent-aid",
        "Could not find entity identified by `:aid`",
        "An entity with an Arachne ID of `:aid` was referenced from a `:dsl-fn` DSL form. However, no entity "
            + "with that Arachne ID exists in the config yet. The `:dsl-fn` form requires that the entities it "
            + "references are concretely defined in the context configuration before they are used.",
        List.of(
            "Ensure that you have already created entities with the specified Arachne ID in your config script.",
            "Make sure that the Arachne IDs match exactly, with no typos."
        ),
        Map.of(
            "cfg", "The config as of this invocation",
            "aid", "The missing Arachne ID",
            "dsl-fn", "The DSL form in question"
        )
    );

    public static final ErrorDefinition CONFIG_MODULE_NOT_FOUND = new ErrorDefinition(
        "config-module-not-found",
        "Could not find config module `:module`",
        "You specified that `:module` was a configuration module (a module containing configuration DSL forms). "
            + "However, `:module` could not be found by any of the module catalogues.",
        List.of(
            "Ensure that a module named `:module` is declared in a modules.toml manifest under a module root.",
            "Ensure that the declaration and the usages of `:module` are all typo-free."
        ),
        Map.of("module", "The missing module")
    );

    public static final ErrorDefinition NOT_A_CONFIG_MODULE = new ErrorDefinition(
        "module-is-not-config-module",
        "`:module` is not a config module",
        "You specified that `:module` was a configuration module. Config modules are identified by metadata on "
            + "the module declaration itself: they are expected to declare `config = true`. However, `:module` "
            + "does not carry this flag.",
        List.of(
            "Set `config = true` on the `:module` declaration, if it is intended to be a config module.",
            "Use a different module that is actually a config module."
        ),
        Map.of("module", "The module")
    );

    public static final ErrorDefinition INVALID_DSL_ARGS = new ErrorDefinition(
        "invalid-dsl-args",
        "Invalid arguments to `:dsl-fn`: :problems",
        "The DSL form `:dsl-fn` declares the shape of the arguments it accepts, and the supplied arguments did "
            + "not conform to it. Nothing was added to the configuration.",
        List.of(
            "Check the arguments against the documented signature: :signature",
            "Make sure entity references are created before they are passed to other DSL forms."
        ),
        Map.of(
            "dsl-fn", "The DSL form in question",
            "args", "The arguments as supplied",
            "problems", "Each argument that did not conform",
            "signature", "The declared argument shape"
        )
    );

    public static final ErrorDefinition UNKNOWN_DSL_FUNCTION = new ErrorDefinition(
        "unknown-dsl-function",
        "No DSL form named `:dsl-fn` is registered",
        "A script called the DSL form `:dsl-fn`, but no form with that name has been registered with the engine.",
        List.of("Register the form with DslRegistry.register before evaluating scripts that use it."),
        Map.of("dsl-fn", "The requested DSL form")
    );

    public static final ErrorDefinition UNRESOLVED_FUNCTION = new ErrorDefinition(
        "unresolved-initializer-function",
        "Could not resolve initializer function `:function`",
        ":reason. Named initializer functions must be public static methods that accept a ConfigGraph and "
            + "return a ConfigGraph.",
        List.of(
            "Use the form `fully.qualified.ClassName#method`.",
            "Ensure the class is on the classpath and the method is public and static."
        ),
        Map.of("function", "The reference as given", "reason", "Why resolution failed")
    );

    public static final ErrorDefinition SCRIPT_EVALUATION_FAILED = new ErrorDefinition(
        "script-evaluation-failed",
        "Error evaluating config script `:namespace`: :cause",
        "The script raised an error while it was being evaluated. The configuration built so far by this "
            + "initializer has been discarded.",
        List.of("Inspect the script frames below to locate the failing statement."),
        Map.of("namespace", "The evaluation namespace", "origin", "Where the script came from", "cause", "The script error")
    );

    public static final ErrorDefinition INVALID_TRANSACTION = new ErrorDefinition(
        "invalid-transaction",
        "Invalid transaction data: :reason",
        "The configuration store rejected an operation in a transaction. No part of the transaction was applied.",
        List.of("Check that every entity reference points to an entity that exists in the config."),
        Map.of("reason", "What was wrong", "op", "The offending operation")
    );

    public static final ErrorDefinition CYCLIC_MODULE_DEPENDENCY = new ErrorDefinition(
        "cyclic-module-dependency",
        "Cyclic dependency between config modules: :cycle",
        "Config modules may require other modules, but the requirements must not form a cycle.",
        List.of("Move the shared forms into a module that both sides can require."),
        Map.of("cycle", "The chain of module identifiers that forms the cycle")
    );
}
