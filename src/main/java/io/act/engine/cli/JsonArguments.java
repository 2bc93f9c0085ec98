package io.act.engine.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;

/**
 * Reads a JSON object argument given inline, as {@code @file} or a file path, or {@code -} for stdin.
 */
final class JsonArguments {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonArguments() {}

    static String readText(String raw, CommandLine commandLine, InputStream stdin) {
        if (raw == null || raw.isBlank()) {
            return "{}";
        }
        String text;
        String trimmed = raw.trim();
        if ("-".equals(trimmed)) {
            try {
                byte[] bytes = stdin.readAllBytes();
                text = bytes.length == 0 ? "{}" : new String(bytes, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(commandLine, "Unable to read stdin: " + ex.getMessage(), ex);
            }
        } else if (trimmed.startsWith("{")) {
            text = trimmed;
        } else {
            Path path = Path.of(trimmed.startsWith("@") ? trimmed.substring(1) : trimmed).toAbsolutePath().normalize();
            try {
                text = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(commandLine, "Cannot read JSON file: " + path);
            }
        }
        parse(text, commandLine);
        return text;
    }

    static Map<String, Object> parse(String text, CommandLine commandLine) {
        if (text == null || text.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            var node = JSON.readTree(text);
            if (node != null && !node.isObject()) {
                throw new CommandLine.ParameterException(commandLine, "JSON payload must be an object");
            }
            Map<String, Object> value = JSON.convertValue(node, MAP_TYPE);
            return value == null ? new LinkedHashMap<>() : new LinkedHashMap<>(value);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(commandLine, "Invalid JSON payload: " + ex.getMessage());
        }
    }

    static String pretty(Object value) throws IOException {
        return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
