package io.act.engine.dispatch;

import io.act.engine.runtime.WorkflowResult;
import java.util.Optional;

public record DispatchOutcome(DispatchPlan plan, Optional<WorkflowResult> result) {}
