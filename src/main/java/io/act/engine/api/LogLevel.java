package io.act.engine.api;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

/**
 * Verbosity of the engine's own loggers ({@code io.act.engine.*}). Flow {@code log_message}
 * output keeps its own logger and is not affected.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    OFF(Level.OFF);

    static final String ENGINE_LOGGER = "io.act.engine";
    private static final String FLOW_LOGGER = "io.act.engine.flow.log";

    private final Level logback;

    LogLevel(Level logback) {
        this.logback = logback;
    }

    /**
     * Blank means the default, {@link #WARN}; {@code warning} is accepted for {@link #WARN}.
     */
    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        if (name.equals("WARNING")) {
            return WARN;
        }
        return Arrays.stream(values())
            .filter(level -> level.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported log level: " + value + " (expected one of "
                + Arrays.stream(values()).map(level -> level.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")) + ")"));
    }

    /**
     * No-op when SLF4J is bound to something other than Logback.
     */
    public void apply() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        context.getLogger(ENGINE_LOGGER).setLevel(logback);
        var flowLog = context.getLogger(FLOW_LOGGER);
        if (flowLog.getLevel() == null) {
            flowLog.setLevel(Level.INFO);
        }
    }
}
