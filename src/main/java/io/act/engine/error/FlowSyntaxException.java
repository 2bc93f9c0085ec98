package io.act.engine.error;

/**
 * Raised when a flow source cannot be turned into a {@code FlowDefinition}.
 * {@link #line()} is 1-based, or {@code -1} when the problem is not tied to a line.
 */
public final class FlowSyntaxException extends ActEngineException {
    private final int line;

    public FlowSyntaxException(String message) {
        this(message, -1, null);
    }

    public FlowSyntaxException(String message, int line) {
        this(message, line, null);
    }

    public FlowSyntaxException(String message, int line, Throwable cause) {
        super("flow_syntax", line > 0 ? message + " (line " + line + ")" : message, cause);
        this.line = line;
    }

    public int line() {
        return line;
    }
}
