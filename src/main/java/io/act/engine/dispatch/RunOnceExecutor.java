package io.act.engine.dispatch;

import io.act.engine.flow.AgentConfig;
import io.act.engine.flow.FlowDefinition;
import io.act.engine.runtime.FlowScheduler;
import io.act.engine.runtime.StepResult;
import io.act.engine.runtime.WorkflowResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes the live flow on demand. Each run captures the flow reference once at its start.
 */
public final class RunOnceExecutor {
    private static final Logger log = LoggerFactory.getLogger(RunOnceExecutor.class);

    private final FlowScheduler scheduler;
    private final Supplier<FlowDefinition> flow;
    private final AtomicInteger executions = new AtomicInteger();
    private final AtomicReference<WorkflowResult> lastResult = new AtomicReference<>();

    public RunOnceExecutor(FlowScheduler scheduler, Supplier<FlowDefinition> flow) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.flow = Objects.requireNonNull(flow, "flow");
    }

    public WorkflowResult executeFromStart(Map<String, Object> input) {
        var definition = flow.get();
        var result = scheduler.run(definition, input == null ? Map.of() : input);
        executions.incrementAndGet();
        lastResult.set(result);
        return result;
    }

    public StepResult executeStep(String stepId, Map<String, Object> input) {
        var result = scheduler.runStep(flow.get(), stepId, input == null ? Map.of() : input);
        executions.incrementAndGet();
        return result;
    }

    /**
     * Runs the flow when its configuration sets {@code auto_execute}.
     */
    public Optional<WorkflowResult> autoExecuteOnLoad() {
        var definition = flow.get();
        boolean autoExecute = definition.agent().map(AgentConfig::autoExecute).orElse(false);
        if (!autoExecute || definition.isEmpty()) {
            return Optional.empty();
        }
        log.info("Auto-executing flow '{}'", definition.name());
        return Optional.of(executeFromStart(Map.of()));
    }

    public Map<String, Object> status() {
        var definition = flow.get();
        var status = new LinkedHashMap<String, Object>();
        status.put("flow", definition.name());
        status.put("steps", definition.steps().size());
        status.put("start_step", definition.startStep().orElse(null));
        status.put("executions", executions.get());
        var last = lastResult.get();
        status.put("last_status", last == null ? null : last.status().wireName());
        status.put("ready", !definition.isEmpty());
        return status;
    }
}
