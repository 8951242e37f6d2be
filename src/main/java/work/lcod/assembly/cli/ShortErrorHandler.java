package work.lcod.assembly.cli;

import java.nio.file.FileSystemException;
import picocli.CommandLine;

/**
 * Prints a one-line report of why {@code lcod-assemble} could not finish. Resolution problems
 * never get here: they are part of the JSON report.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "lcod.assembly.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText("lcod-assemble: " + describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root instanceof FileSystemException fs) {
            var reason = fs.getReason() != null ? fs.getReason() : fs.getClass().getSimpleName();
            return "cannot write report to " + fs.getFile() + " (" + reason + ")";
        }
        var message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }
}
