package io.act.engine.runtime;

import java.util.Locale;

public enum WorkflowStatus {
    SUCCESS,
    PARTIAL,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
