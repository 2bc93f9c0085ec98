package io.act.engine.error;

import java.nio.file.Path;

public final class FlowNotFoundException extends ActEngineException {
    private final Path path;

    public FlowNotFoundException(Path path) {
        super("flow_not_found", "Flow file not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
