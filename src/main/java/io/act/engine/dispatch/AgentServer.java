package io.act.engine.dispatch;

import io.act.engine.flow.FlowDefinition;

/**
 * Persistent server that exposes a flow's routes. Provided by the embedding application.
 */
@FunctionalInterface
public interface AgentServer {
    void serve(FlowDefinition flow, DispatchPlan plan) throws Exception;
}
