package io.act.engine.error;

public final class DuplicateCapabilityException extends ActEngineException {
    private final String key;

    public DuplicateCapabilityException(String key) {
        super("duplicate_capability", "Capability already registered under: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
