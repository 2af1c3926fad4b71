package work.lcod.capsule.cli;

import picocli.CommandLine;
import work.lcod.capsule.error.CapsuleException;

/**
 * Reports a failed command as one line naming the root cause; {@code -Dcapsule.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int CAPSULE_ERROR_EXIT_CODE = 2;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof CapsuleException capsuleError) {
            message = "[" + capsuleError.code() + "] " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("capsule.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return ex instanceof CapsuleException
            ? CAPSULE_ERROR_EXIT_CODE
            : commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
