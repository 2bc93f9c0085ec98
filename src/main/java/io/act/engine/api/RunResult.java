package io.act.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * What one {@link ActRunner} call produced. The CLI prints it as JSON and exits with
 * {@link Status#exitCode()}.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter PRETTY = new ObjectMapper().writerWithDefaultPrettyPrinter();
    static final String ERROR = "error";
    static final String ERROR_TYPE = "error_type";

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult of(Status status, Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(status, metadata, startedAt, Instant.now());
    }

    /**
     * A failed run; {@code errorType} is the stable code callers branch on.
     */
    public static RunResult failure(String message, String errorType, Map<String, Object> metadata, Instant startedAt) {
        var details = new LinkedHashMap<String, Object>(metadata);
        details.putIfAbsent(ERROR, message);
        details.putIfAbsent(ERROR_TYPE, errorType);
        return of(Status.FAILURE, details, startedAt);
    }

    public Optional<String> errorType() {
        return Optional.ofNullable(metadata.get(ERROR_TYPE)).map(String::valueOf);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("status", status.wireName());
        out.put("metadata", metadata);
        out.put("startedAt", startedAt.toString());
        out.put("finishedAt", finishedAt.toString());
        out.put("elapsedMs", elapsed().toMillis());
        return out;
    }

    public String toPrettyJson() {
        try {
            return PRETTY.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            // a capability returned something Jackson cannot serialize
            var fallback = new LinkedHashMap<String, Object>();
            fallback.put("status", status.wireName());
            fallback.put(ERROR, "Result could not be serialized: " + ex.getOriginalMessage());
            try {
                return PRETTY.writeValueAsString(fallback);
            } catch (JsonProcessingException impossible) {
                throw new IllegalStateException(impossible);
            }
        }
    }

    /**
     * Run outcome; partial runs share the usage-error exit code.
     */
    public enum Status {
        SUCCESS(0),
        PARTIAL(2),
        FAILURE(1),
        PLANNED(0);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
