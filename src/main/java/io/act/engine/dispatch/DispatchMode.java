package io.act.engine.dispatch;

public enum DispatchMode {
    /** Persistent server exposing the flow's routes. */
    SERVER,
    RUN_ONCE,
    /** No steps yet; nothing to run until a flow with steps is loaded. */
    WAITING
}
