package io.act.engine.dispatch;

import io.act.engine.error.ActEngineException;
import io.act.engine.flow.AgentConfig;
import io.act.engine.flow.FlowDefinition;
import io.act.engine.runtime.FlowScheduler;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses between serving a flow persistently and running it once.
 */
public final class FlowDispatcher {
    private static final Logger log = LoggerFactory.getLogger(FlowDispatcher.class);

    private final FlowScheduler scheduler;
    private final Optional<AgentServer> server;

    public FlowDispatcher(FlowScheduler scheduler) {
        this(scheduler, Optional.empty());
    }

    public FlowDispatcher(FlowScheduler scheduler, Optional<AgentServer> server) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.server = server == null ? Optional.empty() : server;
    }

    /**
     * Routes, an enabled agent or a deployment section select {@link DispatchMode#SERVER};
     * a flow without steps is {@link DispatchMode#WAITING}; anything else runs once.
     */
    public DispatchPlan decide(FlowDefinition flow) {
        if (flow.isEmpty()) {
            return plan(DispatchMode.WAITING, "flow has no steps", flow);
        }
        var reasons = new ArrayList<String>();
        if (!flow.routes().isEmpty()) {
            reasons.add(flow.routes().size() + " route(s)");
        }
        if (flow.agent().map(AgentConfig::enabled).orElse(false)) {
            reasons.add("agent enabled");
        }
        if (flow.deployment().isPresent()) {
            reasons.add("deployment section");
        }
        if (reasons.isEmpty()) {
            return plan(DispatchMode.RUN_ONCE, "no routes or agent configuration", flow);
        }
        return plan(DispatchMode.SERVER, String.join(", ", reasons), flow);
    }

    public DispatchOutcome dispatch(FlowDefinition flow, Map<String, Object> input) {
        var plan = decide(flow);
        log.info("Flow '{}' dispatch mode {}: {}", flow.name(), plan.mode(), plan.reason());
        switch (plan.mode()) {
            case WAITING:
                return new DispatchOutcome(plan, Optional.empty());
            case SERVER:
                if (server.isPresent()) {
                    try {
                        server.get().serve(flow, plan);
                    } catch (ActEngineException ex) {
                        throw ex;
                    } catch (Exception ex) {
                        throw new ActEngineException("server_failed", "Agent server failed for flow '" + flow.name() + "': " + ex.getMessage(), ex);
                    }
                    return new DispatchOutcome(plan, Optional.empty());
                }
                log.warn("Flow '{}' needs an agent server to be deployed; none is configured", flow.name());
                return new DispatchOutcome(plan, Optional.empty());
            default:
                break;
        }
        var executor = new RunOnceExecutor(scheduler, () -> flow);
        return new DispatchOutcome(plan, Optional.of(executor.executeFromStart(input)));
    }

    private static DispatchPlan plan(DispatchMode mode, String reason, FlowDefinition flow) {
        return new DispatchPlan(mode, reason, flow.routes(), flow.agent(), flow.deployment());
    }
}
