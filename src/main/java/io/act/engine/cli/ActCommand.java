package io.act.engine.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "act",
    description = "Run ACT flows and execute single steps.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {ActRunCommand.class, ActExecCommand.class}
)
final class ActCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        var out = spec.commandLine().getOut();
        spec.commandLine().usage(out);
        out.flush();
    }
}
