package io.act.engine.runtime;

import io.act.engine.error.CapabilityExecutionException;
import io.act.engine.error.UnknownCapabilityException;
import io.act.engine.flow.FlowDefinition;
import io.act.engine.flow.StepSpec;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a flow's steps sequentially in dependency order and aggregates their outcomes.
 * Step failures are recorded, never thrown; only structural problems (cycles, unknown types)
 * abort a run, and they do so before the first step executes.
 */
public final class FlowScheduler {
    private static final Logger log = LoggerFactory.getLogger(FlowScheduler.class);

    private final CapabilityRegistry registry;
    private final PlaceholderResolver resolver;
    private final Optional<Duration> stepTimeout;

    public FlowScheduler(CapabilityRegistry registry) {
        this(registry, new PlaceholderResolver(), Optional.empty());
    }

    public FlowScheduler(CapabilityRegistry registry, PlaceholderResolver resolver, Optional<Duration> stepTimeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.stepTimeout = stepTimeout == null ? Optional.empty() : stepTimeout;
    }

    public WorkflowResult run(FlowDefinition flow, Map<String, Object> initialInput) {
        Objects.requireNonNull(flow, "flow");
        var graph = StepGraph.build(flow);
        var factories = resolveFactories(flow);
        var context = new ExecutionContext(initialInput);
        String entry = flow.startStep().orElse(null);

        log.info("Running flow '{}' ({} steps)", flow.name(), graph.order().size());
        long started = System.nanoTime();
        for (String stepId : graph.order()) {
            var step = flow.step(stepId).orElseThrow();
            var input = stepId.equals(entry) ? context.input() : Map.<String, Object>of();
            context.record(stepId, executeStep(step, factories.get(stepId), graph.dependenciesOf(stepId), context, input));
        }
        var elapsed = Duration.ofNanos(System.nanoTime() - started);

        var results = context.results();
        var status = aggregateStatus(results);
        log.info("Flow '{}' finished with status {} in {} ms", flow.name(), status.wireName(), elapsed.toMillis());
        return new WorkflowResult(flow.name(), status, graph.order(), output(graph, context), results, elapsed);
    }

    /**
     * Executes one step in isolation. Placeholders can only see {@code input}.
     */
    public StepResult runStep(FlowDefinition flow, String stepId, Map<String, Object> input) {
        var step = flow.step(stepId).orElseThrow(() -> new IllegalArgumentException("Unknown step: " + stepId));
        var context = new ExecutionContext(input);
        return executeStep(step, registry.resolve(step.type()), Set.of(), context, context.input());
    }

    private Map<String, CapabilityFactory> resolveFactories(FlowDefinition flow) {
        var factories = new LinkedHashMap<String, CapabilityFactory>();
        var unknown = new ArrayList<String>();
        for (StepSpec step : flow.steps()) {
            if (registry.isRegistered(step.type())) {
                factories.put(step.id(), registry.resolve(step.type()));
            } else {
                unknown.add(step.type());
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownCapabilityException(String.join(", ", unknown));
        }
        return factories;
    }

    private StepResult executeStep(
        StepSpec step,
        CapabilityFactory factory,
        Set<String> dependencies,
        ExecutionContext context,
        Map<String, Object> extraInput
    ) {
        long started = System.nanoTime();
        Capability capability;
        CapabilityDescriptor descriptor;
        try {
            capability = factory.create();
            descriptor = capability.describe();
        } catch (RuntimeException ex) {
            return failed(step, ex, started);
        }

        var params = resolver.resolveParams(step.params(), context);
        var skipReason = skipReason(params, descriptor, dependencies, context);
        if (skipReason.isPresent()) {
            log.info("Skipping step '{}': {}", step.id(), skipReason.get());
            return StepResult.skipped(skipReason.get());
        }
        params.putAll(extraInput);

        Capability target = stepTimeout.<Capability>map(timeout -> new TimedCapability(capability, timeout))
            .orElse(capability);
        log.debug("Executing step '{}' ({})", step.id(), step.type());
        CapabilityResult outcome;
        try {
            outcome = CapabilityInvoker.invoke(target, params);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return failed(step, ex, started);
        } catch (Exception ex) {
            return failed(step, ex, started);
        }
        long duration = millisSince(started);
        if (outcome == null) {
            return failed(step, new IllegalStateException("capability returned no result"), started);
        }
        if (!outcome.isSuccess()) {
            log.warn("Step '{}' ({}) reported an error: {}", step.id(), step.type(), outcome.error());
            return StepResult.error(outcome.error(), duration);
        }
        return StepResult.success(outcome.result(), duration);
    }

    private StepResult failed(StepSpec step, Exception cause, long started) {
        String reason = cause instanceof TimeoutException
            ? "timed out after " + stepTimeout.map(Duration::toMillis).orElse(0L) + " ms"
            : Objects.requireNonNullElse(cause.getMessage(), cause.getClass().getSimpleName());
        var error = new CapabilityExecutionException(step.id(),
            "Step '" + step.id() + "' (" + step.type() + ") failed: " + reason, cause);
        log.warn(error.getMessage());
        log.debug("Step '{}' failure details", step.id(), cause);
        return StepResult.error(error.getMessage(), millisSince(started));
    }

    /**
     * A step is skipped when a required parameter still carries a placeholder that points at a
     * dependency which did not succeed.
     */
    private static Optional<String> skipReason(
        Map<String, Object> params,
        CapabilityDescriptor descriptor,
        Set<String> dependencies,
        ExecutionContext context
    ) {
        var failed = new ArrayList<String>();
        for (String dependency : dependencies) {
            boolean succeeded = context.result(dependency).map(StepResult::succeeded).orElse(false);
            if (!succeeded) {
                failed.add(dependency);
            }
        }
        if (failed.isEmpty()) {
            return Optional.empty();
        }
        for (var entry : params.entrySet()) {
            if (!descriptor.isRequired(entry.getKey()) || !PlaceholderResolver.hasUnresolved(entry.getValue())) {
                continue;
            }
            for (String ref : PlaceholderResolver.references(entry.getValue())) {
                if (failed.contains(ref)) {
                    return Optional.of("dependency '" + ref + "' did not succeed (parameter '" + entry.getKey() + "')");
                }
            }
        }
        return Optional.empty();
    }

    private static Object output(StepGraph graph, ExecutionContext context) {
        List<String> terminals = graph.terminalSteps();
        if (terminals.isEmpty()) {
            return Map.of();
        }
        if (terminals.size() == 1) {
            return context.result(terminals.get(0)).map(StepResult::result).orElse(null);
        }
        if (terminals.size() == graph.order().size()) {
            return context.snapshot();
        }
        var output = new LinkedHashMap<String, Object>();
        for (String terminal : terminals) {
            output.put(terminal, context.result(terminal).map(StepResult::result).orElse(null));
        }
        return output;
    }

    private static WorkflowStatus aggregateStatus(Map<String, StepResult> results) {
        long succeeded = results.values().stream().filter(StepResult::succeeded).count();
        if (succeeded == results.size()) {
            return WorkflowStatus.SUCCESS;
        }
        return succeeded == 0 ? WorkflowStatus.ERROR : WorkflowStatus.PARTIAL;
    }

    private static long millisSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
