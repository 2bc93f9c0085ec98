package io.act.engine.cli;

import io.act.engine.error.ActEngineException;
import java.util.Objects;
import picocli.CommandLine;

/**
 * One line per failure, prefixed with the engine error code when there is one.
 * {@code -Dact.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "act.debug";

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        String text = Objects.requireNonNullElse(ex.getMessage(), "");
        if (text.isBlank()) {
            text = ex.getClass().getSimpleName();
        }
        return ex instanceof ActEngineException engine ? "[" + engine.code() + "] " + text : text;
    }
}
