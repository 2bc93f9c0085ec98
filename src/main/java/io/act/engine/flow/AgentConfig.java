package io.act.engine.flow;

/**
 * Values of the {@code [configuration]} section.
 */
public record AgentConfig(
    String name,
    boolean enabled,
    String host,
    int port,
    boolean debug,
    boolean corsEnabled,
    boolean autoReload,
    boolean autoExecute
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8080;
}
