package io.act.engine.flow;

/**
 * Values of the {@code [deployment]} section.
 */
public record DeploymentConfig(
    String environment,
    int workers,
    boolean sslEnabled,
    String sslCert,
    String sslKey
) {
    public static final String DEFAULT_ENVIRONMENT = "development";
}
