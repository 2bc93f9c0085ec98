package io.act.engine.cli;

import io.act.engine.api.ActRunConfiguration;
import io.act.engine.api.ActRunner;
import io.act.engine.api.LogLevel;
import io.act.engine.api.RunResult;
import io.act.engine.api.WatchSession;
import io.act.engine.error.ActEngineException;
import io.act.engine.flow.FlowLoader;
import io.act.engine.runtime.CapabilityCatalog;
import io.act.engine.shared.DurationParser;
import io.act.engine.watch.FlowWatcher;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "run",
    description = "Load a flow, decide how to dispatch it and run it.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ActRunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-f", "--flow"},
        paramLabel = "PATH",
        description = "Flow file (Actfile, *.act, *.yaml); searched in the working directory when omitted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path flow;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "JSON|@PATH|-",
        description = "Input payload for the entry step: inline JSON, a file, or '-' for stdin (default: {}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String input;

    @CommandLine.Option(
        names = {"-p", "--profile"},
        paramLabel = "PATH",
        description = "Credential profile whose defaults and auth are injected into matching steps.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path profile;

    @CommandLine.Option(
        names = "--plugins",
        paramLabel = "DIR",
        description = "Directory of capability jars to discover (repeatable).",
        arity = "1..*"
    )
    private List<Path> pluginDirectories = new ArrayList<>();

    @CommandLine.Option(
        names = {"-w", "--watch"},
        description = "Keep running and re-run the flow whenever its file changes."
    )
    private boolean watch;

    @CommandLine.Option(
        names = "--poll-interval",
        description = "Watch polling interval (e.g. 500ms, 2s).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String pollIntervalRaw;

    @CommandLine.Option(
        names = "--debounce",
        description = "Time a change must persist before it is reloaded.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String debounceRaw;

    @CommandLine.Option(
        names = "--timeout",
        description = "Per-step timeout (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--plan",
        description = "Print the dispatch plan and execution order without running anything."
    )
    private boolean planOnly;

    @CommandLine.Option(
        names = "--log-level",
        description = "Engine log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        var workingDir = Path.of("").toAbsolutePath();
        var configuration = ActRunConfiguration.builder()
            .flowPath(resolveFlow(workingDir))
            .workingDirectory(workingDir)
            .profilePath(Optional.ofNullable(profile))
            .capabilityDirectories(pluginDirectories)
            .inputPayload(JsonArguments.readText(input, spec.commandLine(), System.in))
            .stepTimeout(duration(timeoutRaw, "--timeout"))
            .watch(watch)
            .pollInterval(duration(pollIntervalRaw, "--poll-interval").orElse(FlowWatcher.DEFAULT_POLL_INTERVAL))
            .debounce(duration(debounceRaw, "--debounce").orElse(FlowWatcher.DEFAULT_DEBOUNCE))
            .planOnly(planOnly)
            .logLevel(resolveLogLevel())
            .build();

        var registry = CapabilityCatalog.create();
        registry.discoverInstalled();
        var runner = new ActRunner(registry, Optional.empty());
        if (!configuration.watch() || configuration.planOnly()) {
            RunResult result = runner.run(configuration);
            print(result);
            return result.status().exitCode();
        }
        return watch(runner, configuration);
    }

    private int watch(ActRunner runner, ActRunConfiguration configuration) throws InterruptedException {
        WatchSession session;
        try {
            session = runner.watch(configuration, this::print);
        } catch (ActEngineException ex) {
            print(RunResult.failure(ex.getMessage(), ex.code(), Map.of("flow", configuration.resolvedFlowPath().toString()), Instant.now()));
            return RunResult.Status.FAILURE.exitCode();
        }
        Runtime.getRuntime().addShutdownHook(new Thread(session::close, "act-shutdown"));
        session.awaitClose();
        return 0;
    }

    private synchronized void print(RunResult result) {
        var out = spec.commandLine().getOut();
        out.println(result.toPrettyJson());
        out.flush();
    }

    private Path resolveFlow(Path workingDir) {
        return flow != null ? flow : FlowLoader.find(workingDir);
    }

    private Optional<Duration> duration(String raw, String option) {
        try {
            return DurationParser.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), option + ": " + ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
