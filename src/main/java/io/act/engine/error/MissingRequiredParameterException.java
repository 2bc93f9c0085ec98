package io.act.engine.error;

import java.util.List;

/**
 * Lists every required parameter that is absent, not only the first one.
 */
public final class MissingRequiredParameterException extends ActEngineException {
    private final List<String> missing;

    public MissingRequiredParameterException(String type, String operation, List<String> missing) {
        super("missing_required_parameter",
            "Missing required parameters for " + type + "." + operation + ": " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
