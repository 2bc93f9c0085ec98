package io.act.engine.error;

public final class UnknownCapabilityException extends ActEngineException {
    private final String type;

    public UnknownCapabilityException(String type) {
        super("unknown_capability", "No capability registered for type: " + type);
        this.type = type;
    }

    public String type() {
        return type;
    }
}
