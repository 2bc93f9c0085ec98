package io.act.engine.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.act.engine.dispatch.AgentServer;
import io.act.engine.dispatch.DispatchMode;
import io.act.engine.dispatch.DispatchOutcome;
import io.act.engine.dispatch.FlowDispatcher;
import io.act.engine.dispatch.RunOnceExecutor;
import io.act.engine.error.ActEngineException;
import io.act.engine.flow.FlowDefinition;
import io.act.engine.flow.FlowLoader;
import io.act.engine.profile.CredentialProfile;
import io.act.engine.profile.FlowCredentials;
import io.act.engine.runtime.CapabilityCatalog;
import io.act.engine.runtime.CapabilityRegistry;
import io.act.engine.runtime.FlowScheduler;
import io.act.engine.runtime.PlaceholderResolver;
import io.act.engine.runtime.StepGraph;
import io.act.engine.runtime.WorkflowResult;
import io.act.engine.runtime.WorkflowStatus;
import io.act.engine.watch.FlowWatcher;
import io.act.engine.watch.LiveFlow;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point for embedding the engine.
 */
public final class ActRunner {
    private static final Logger log = LoggerFactory.getLogger(ActRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final CapabilityRegistry registry;
    private final Optional<AgentServer> server;

    public ActRunner() {
        this(CapabilityCatalog.create(), Optional.empty());
    }

    public ActRunner(CapabilityRegistry registry, Optional<AgentServer> server) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.server = server == null ? Optional.empty() : server;
    }

    public RunResult run(ActRunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("flow", configuration.resolvedFlowPath().toString());
        try {
            configuration.logLevel().apply();
            var flow = loadFlow(configuration, new FlowLoader());
            metadata.put("name", flow.name());
            var input = parseInput(configuration.inputPayload());
            var dispatcher = new FlowDispatcher(scheduler(configuration), server);

            if (configuration.planOnly()) {
                var plan = dispatcher.decide(flow);
                metadata.put("plan", plan.toMap());
                metadata.put("execution_order", StepGraph.build(flow).order());
                return RunResult.of(RunResult.Status.PLANNED, metadata, started);
            }

            var outcome = dispatcher.dispatch(flow, input);
            return toRunResult(outcome, metadata, started);
        } catch (ActEngineException ex) {
            debugTrace(ex);
            return RunResult.failure(ex.getMessage(), ex.code(), metadata, started);
        } catch (RuntimeException ex) {
            debugTrace(ex);
            return RunResult.failure(String.valueOf(ex.getMessage()), "internal_error", metadata, started);
        }
    }

    /**
     * Runs the flow once, then keeps it live: every confirmed change to the flow file swaps the
     * definition and re-runs it, reporting each run to {@code onRun}.
     */
    public WatchSession watch(ActRunConfiguration configuration, Consumer<RunResult> onRun) {
        configuration.logLevel().apply();
        var loader = new FlowLoader();
        var profile = loadProfile(configuration);
        var live = new LiveFlow(withCredentials(loader.load(configuration.resolvedFlowPath()), profile));
        var input = parseInput(configuration.inputPayload());
        var executor = new RunOnceExecutor(scheduler(configuration), live::get);

        var watcher = new FlowWatcher(configuration.resolvedFlowPath(), configuration.pollInterval(), configuration.debounce());
        watcher.register("live-flow", live.reloadCallback(loader, next -> withCredentials(next, profile)));
        var lastRun = new AtomicLong(live.generation());
        watcher.register("re-run", event -> {
            long generation = live.generation();
            if (lastRun.getAndSet(generation) != generation) {
                onRun.accept(executeLive(executor, input, live.get()));
            }
        });

        onRun.accept(executeLive(executor, input, live.get()));
        watcher.start();
        return new WatchSession(watcher, live, executor);
    }

    private RunResult executeLive(RunOnceExecutor executor, Map<String, Object> input, FlowDefinition flow) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("name", flow.name());
        try {
            var result = executor.executeFromStart(input);
            metadata.put("mode", DispatchMode.RUN_ONCE.name().toLowerCase(Locale.ROOT));
            metadata.put("result", result.toMap());
            return RunResult.of(statusOf(result), metadata, started);
        } catch (ActEngineException ex) {
            debugTrace(ex);
            return RunResult.failure(ex.getMessage(), ex.code(), metadata, started);
        }
    }

    private FlowScheduler scheduler(ActRunConfiguration configuration) {
        for (var directory : configuration.capabilityDirectories()) {
            registry.discover(configuration.workingDirectory().resolve(directory));
        }
        return new FlowScheduler(registry, new PlaceholderResolver(), configuration.stepTimeout());
    }

    private static FlowDefinition loadFlow(ActRunConfiguration configuration, FlowLoader loader) {
        return withCredentials(loader.load(configuration.resolvedFlowPath()), loadProfile(configuration));
    }

    private static Optional<CredentialProfile> loadProfile(ActRunConfiguration configuration) {
        return configuration.profilePath()
            .map(path -> CredentialProfile.load(configuration.workingDirectory().resolve(path)));
    }

    private static FlowDefinition withCredentials(FlowDefinition flow, Optional<CredentialProfile> profile) {
        return profile.map(credentials -> FlowCredentials.inject(flow, credentials)).orElse(flow);
    }

    private static RunResult toRunResult(DispatchOutcome outcome, Map<String, Object> metadata, Instant started) {
        var plan = outcome.plan();
        metadata.put("mode", plan.mode().name().toLowerCase(Locale.ROOT));
        if (outcome.result().isEmpty()) {
            metadata.put("plan", plan.toMap());
            if (plan.mode() == DispatchMode.SERVER) {
                metadata.put("requires_deployment", true);
            }
            return RunResult.of(RunResult.Status.SUCCESS, metadata, started);
        }
        var result = outcome.result().get();
        metadata.put("result", result.toMap());
        return RunResult.of(statusOf(result), metadata, started);
    }

    private static RunResult.Status statusOf(WorkflowResult result) {
        if (result.status() == WorkflowStatus.SUCCESS) {
            return RunResult.Status.SUCCESS;
        }
        return result.status() == WorkflowStatus.PARTIAL ? RunResult.Status.PARTIAL : RunResult.Status.FAILURE;
    }

    static Map<String, Object> parseInput(String payload) {
        if (payload == null || payload.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var parsed = JSON.readValue(payload, MAP_REF);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new ActEngineException("invalid_input", "Invalid JSON input payload: " + ex.getMessage(), ex);
        }
    }

    private static void debugTrace(Exception ex) {
        if (Boolean.getBoolean("act.debug")) {
            log.error("Run failed", ex);
        }
    }
}
