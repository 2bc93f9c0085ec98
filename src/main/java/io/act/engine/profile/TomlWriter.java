package io.act.engine.profile;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Serializes a profile document to TOML. Top-level maps become {@code [table]} sections and
 * deeper maps are written as inline tables; {@code null} values are omitted.
 */
final class TomlWriter {
    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_-]+");

    private TomlWriter() {}

    static String write(Map<String, Object> document) {
        var out = new StringBuilder();
        var sections = new ArrayList<Map.Entry<String, Object>>();
        for (var entry : document.entrySet()) {
            if (entry.getValue() instanceof Map<?, ?>) {
                sections.add(entry);
            } else if (entry.getValue() != null) {
                out.append(key(entry.getKey())).append(" = ").append(value(entry.getValue())).append('\n');
            }
        }
        for (var section : sections) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append('[').append(key(section.getKey())).append("]\n");
            Map<?, ?> table = (Map<?, ?>) section.getValue();
            for (var entry : table.entrySet()) {
                if (entry.getValue() != null) {
                    out.append(key(String.valueOf(entry.getKey()))).append(" = ").append(value(entry.getValue())).append('\n');
                }
            }
        }
        return out.toString();
    }

    private static String key(String key) {
        return BARE_KEY.matcher(key).matches() ? key : quote(key);
    }

    private static String value(Object value) {
        if (value instanceof Map<?, ?> map) {
            var parts = new ArrayList<String>();
            for (var entry : map.entrySet()) {
                if (entry.getValue() != null) {
                    parts.add(key(String.valueOf(entry.getKey())) + " = " + value(entry.getValue()));
                }
            }
            return parts.isEmpty() ? "{}" : "{ " + String.join(", ", parts) + " }";
        }
        if (value instanceof List<?> list) {
            var parts = new ArrayList<String>();
            for (Object item : list) {
                if (item != null) {
                    parts.add(value(item));
                }
            }
            return "[" + String.join(", ", parts) + "]";
        }
        if (value instanceof Boolean || value instanceof Integer || value instanceof Long) {
            return String.valueOf(value);
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                return "nan";
            }
            if (Double.isInfinite(number)) {
                return number > 0 ? "inf" : "-inf";
            }
            return Double.toString(number);
        }
        if (value instanceof Number number) {
            return number.toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return quote(String.valueOf(value));
    }

    private static String quote(String text) {
        var out = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\u%04X", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
