package io.act.engine.cli;

import io.act.engine.api.LogLevel;
import io.act.engine.profile.CredentialProfile;
import io.act.engine.profile.SingleStepExecutor;
import io.act.engine.runtime.CapabilityCatalog;
import io.act.engine.runtime.CapabilityResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "exec",
    description = "Execute one operation of an authenticated step type using a credential profile.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ActExecCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-p", "--profile"},
        paramLabel = "PATH",
        required = true,
        description = "Credential profile (TOML)."
    )
    private Path profile;

    @CommandLine.Parameters(index = "0", paramLabel = "TYPE", description = "Step type, e.g. github.")
    private String type;

    @CommandLine.Parameters(index = "1", paramLabel = "OPERATION", description = "Operation listed for the type in the profile.")
    private String operation;

    @CommandLine.Option(
        names = "--params",
        paramLabel = "JSON|@PATH|-",
        description = "Runtime parameters; they override profile defaults and auth.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String paramsRaw;

    @CommandLine.Option(
        names = "--validate",
        description = "Only report the merged parameters and missing fields."
    )
    private boolean validateOnly;

    @CommandLine.Option(
        names = "--plugins",
        paramLabel = "DIR",
        description = "Directory of capability jars to discover (repeatable).",
        arity = "1..*"
    )
    private List<Path> pluginDirectories = new ArrayList<>();

    @CommandLine.Option(
        names = "--log-level",
        description = "Engine log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        var commandLine = spec.commandLine();
        try {
            LogLevel.from(logLevelRaw).apply();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(commandLine, ex.getMessage());
        }
        var params = JsonArguments.parse(JsonArguments.readText(paramsRaw, commandLine, System.in), commandLine);

        var registry = CapabilityCatalog.create();
        registry.discoverInstalled();
        for (var directory : pluginDirectories) {
            registry.discover(directory.toAbsolutePath().normalize());
        }
        var executor = new SingleStepExecutor(registry);

        Map<String, Object> report;
        boolean ok;
        if (validateOnly) {
            report = executor.validateParams(CredentialProfile.load(profile), type, operation, params);
            ok = Boolean.TRUE.equals(report.get("valid"));
        } else {
            report = executor.execute(profile, type, operation, params);
            ok = CapabilityResult.SUCCESS.equals(report.get("status"));
        }
        var out = commandLine.getOut();
        out.println(JsonArguments.pretty(report));
        out.flush();
        return ok ? 0 : 1;
    }
}
