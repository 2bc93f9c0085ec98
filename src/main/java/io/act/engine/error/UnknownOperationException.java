package io.act.engine.error;

import java.util.List;

public final class UnknownOperationException extends ActEngineException {
    private final String type;
    private final String operation;
    private final List<String> available;

    public UnknownOperationException(String type, String operation, List<String> available) {
        super("unknown_operation",
            "Operation '" + operation + "' not found for node '" + type + "'. Available operations: "
                + String.join(", ", available));
        this.type = type;
        this.operation = operation;
        this.available = List.copyOf(available);
    }

    public String type() {
        return type;
    }

    public String operation() {
        return operation;
    }

    public List<String> available() {
        return available;
    }
}
