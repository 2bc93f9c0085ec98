package io.act.engine.runtime;

public enum StepStatus {
    SUCCESS("success"),
    ERROR("error"),
    SKIPPED_DEPENDENCY_FAILED("skipped-dependency-failed");

    private final String wireName;

    StepStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
