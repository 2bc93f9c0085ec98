package io.act.engine.cli;

import java.io.PrintWriter;
import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new ActCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    static int execute(PrintWriter out, PrintWriter err, String... args) {
        var commandLine = commandLine();
        commandLine.setOut(out);
        commandLine.setErr(err);
        return commandLine.execute(args);
    }
}
