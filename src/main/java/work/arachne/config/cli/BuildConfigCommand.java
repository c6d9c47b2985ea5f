package work.arachne.config.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.arachne.config.api.BuildResult;
import work.arachne.config.api.ConfigBuildConfiguration;
import work.arachne.config.api.ConfigBuilder;
import work.arachne.config.api.LogLevel;
import work.arachne.config.runtime.Initializer;

@CommandLine.Command(
    name = "arachne-config",
    description = "Build a configuration graph from initializers (functions, modules, scripts, tx data).",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class BuildConfigCommand implements Callable<Integer> {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(BuildConfigCommand.class);

    @CommandLine.Option(
        names = {"-i", "--init"},
        paramLabel = "KIND:VALUE",
        description = "Initializer (fn:pkg.Class#method, module:id, file:path, ops:path, script:source). Repeatable, applied in order."
    )
    private List<String> initializers = new ArrayList<>();

    @CommandLine.Option(
        names = {"-m", "--module-root"},
        paramLabel = "DIR",
        description = "Directory scanned for modules.toml manifests. Repeatable."
    )
    private List<Path> moduleRoots = new ArrayList<>();

    @CommandLine.Option(
        names = {"-w", "--workspace"},
        paramLabel = "PATH",
        description = "Workspace directory or arachne.toml file; its initializers run before --init values.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path workspace;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "Write the result JSON to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        ConfigBuildConfiguration.Builder builder = workspace != null
            ? ConfigBuildConfiguration.fromWorkspace(workspace)
            : ConfigBuildConfiguration.builder();
        Path cwd = Path.of("").toAbsolutePath();
        for (String raw : initializers) {
            builder.initializer(Initializer.parse(raw, cwd));
        }
        moduleRoots.forEach(root -> builder.moduleRoot(root.toAbsolutePath().normalize()));
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        if (output != null) {
            builder.output(output);
        }
        ConfigBuildConfiguration configuration = builder.build();
        if (configuration.initializers().isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "At least one initializer is required (--init or a workspace file).");
        }
        applyLogLevel(configuration.logLevel());

        BuildResult result = new ConfigBuilder().build(configuration);
        String json = result.toPrettyJson();
        if (configuration.output().isPresent()) {
            Path target = configuration.output().get();
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } else {
            spec.commandLine().getOut().println(json);
        }
        log.atInfo()
            .addKeyValue("status", result.status())
            .addKeyValue("elapsedMs", result.elapsed().toMillis())
            .log("Configuration build finished");
        return result.status().exitCode();
    }

    private static void applyLogLevel(LogLevel level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(level.logbackLevel());
            return;
        }
        log.warn("Log level {} requested but backend {} does not support dynamic level updates",
            level, factory.getClass().getName());
    }
}
