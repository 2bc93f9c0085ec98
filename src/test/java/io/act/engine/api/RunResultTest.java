package io.act.engine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RunResultTest {
    @Test
    void failureCarriesMessageAndErrorType() {
        var result = RunResult.failure("no Actfile", "flow_not_found", Map.of("flow", "/tmp/x"), Instant.now());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("no Actfile", result.metadata().get("error"));
        assertEquals("flow_not_found", result.errorType().orElseThrow());
        assertEquals("/tmp/x", result.metadata().get("flow"));
        assertEquals(1, result.status().exitCode());
    }

    @Test
    void serializesStatusInLowerCase() {
        var started = Instant.parse("2024-01-01T00:00:00Z");
        var result = new RunResult(RunResult.Status.PARTIAL, Map.of("name", "demo"), started, started.plusMillis(250));

        var map = result.toSerializableMap();
        assertEquals("partial", map.get("status"));
        assertEquals(250L, map.get("elapsedMs"));
        assertTrue(result.toPrettyJson().contains("\"name\" : \"demo\""));
        assertEquals(2, result.status().exitCode());
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.WARN, LogLevel.from("warning"));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        var error = assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
        assertTrue(error.getMessage().contains("loud"));
    }
}
