package work.arachne.config.cli;

import picocli.CommandLine;
import work.arachne.config.error.ConfigScriptException;

/**
 * Prints the root cause of a CLI failure on one line; {@code -Darachne.debug=true} adds the trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex instanceof ConfigScriptException configError ? configError.explain() : ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("arachne.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
