package work.ecology.kernel.cli;

import java.nio.file.NoSuchFileException;
import picocli.CommandLine;

/**
 * Prints the innermost cause of a failed subcommand as one line prefixed with the command name.
 * Bad input (an unreadable file, an invalid config value) exits with the usage code; anything
 * else keeps picocli's execution-failure code. {@code -Dkernel.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String detail = root instanceof NoSuchFileException missing
            ? "No such file: " + missing.getFile()
            : root.getMessage();
        if (detail == null || detail.isBlank()) {
            detail = root.getClass().getSimpleName();
        }
        String command = commandLine.getCommandName();
        commandLine.getErr().println(commandLine.getColorScheme().errorText(command + ": " + detail));
        if (Boolean.getBoolean("kernel.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        boolean badInput = root instanceof IllegalArgumentException || root instanceof NoSuchFileException;
        return badInput
            ? commandLine.getCommandSpec().exitCodeOnInvalidInput()
            : commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
