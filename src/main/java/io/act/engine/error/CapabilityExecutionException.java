package io.act.engine.error;

public final class CapabilityExecutionException extends ActEngineException {
    private final String stepId;

    public CapabilityExecutionException(String stepId, String message, Throwable cause) {
        super("capability_execution", message, cause);
        this.stepId = stepId;
    }

    public String stepId() {
        return stepId;
    }
}
