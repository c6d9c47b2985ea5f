package work.arachne.config.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class BuildConfigCommandTest {
    private static final Path WORKSPACE = Path.of("src", "test", "resources", "workspace").toAbsolutePath();

    private static CommandLine commandLine(StringWriter out, StringWriter err) {
        return new CommandLine(new BuildConfigCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err));
    }

    @Test
    void printsResultJson() {
        var out = new StringWriter();
        var err = new StringWriter();

        int exit = commandLine(out, err).execute(
            "--workspace", WORKSPACE.toString(),
            "--init", "script:dsl.entity('cli/extra');",
            "--log-level", "fatal"
        );

        assertEquals(0, exit, err::toString);
        assertTrue(out.toString().contains("\"cli/extra\""), out::toString);
    }

    @Test
    void writesOutputFile(@TempDir Path dir) throws Exception {
        var target = dir.resolve("out/result.json");

        int exit = commandLine(new StringWriter(), new StringWriter()).execute(
            "--init", "script:dsl.entity('cli/file');",
            "--output", target.toString(),
            "--log-level", "fatal"
        );

        assertEquals(0, exit);
        assertTrue(Files.readString(target).contains("\"success\""));
    }

    @Test
    void failedBuildExitsWithFailureCode() {
        var out = new StringWriter();

        int exit = commandLine(out, new StringWriter()).execute(
            "--init", "module:app.missing",
            "--log-level", "fatal"
        );

        assertEquals(1, exit);
        assertTrue(out.toString().contains("config-module-not-found"), out::toString);
    }

    @Test
    void requiresAnInitializer() {
        var err = new StringWriter();

        int exit = commandLine(new StringWriter(), err).execute();

        assertEquals(2, exit);
        assertTrue(err.toString().contains("At least one initializer"), err::toString);
    }
}
