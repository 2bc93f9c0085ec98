package io.act.engine.error;

public final class NodeNotAuthenticatedException extends ActEngineException {
    private final String type;

    public NodeNotAuthenticatedException(String type) {
        super("node_not_authenticated",
            "Node '" + type + "' is not authenticated. Add it to the credential profile first.");
        this.type = type;
    }

    public String type() {
        return type;
    }
}
