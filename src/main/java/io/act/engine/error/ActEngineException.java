package io.act.engine.error;

/**
 * Base type for engine failures. Carries a stable machine-readable code next to the message.
 */
public class ActEngineException extends RuntimeException {
    private final String code;

    public ActEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ActEngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
