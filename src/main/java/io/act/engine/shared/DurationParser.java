package io.act.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses short durations such as {@code 500ms}, {@code 30s}, {@code 2m} or {@code 1h}.
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = DURATION.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: '" + raw + "' (expected e.g. 500ms, 30s, 2m, 1h)");
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        return Optional.of(switch (unit) {
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> Duration.ofMillis(amount);
        });
    }

    /**
     * Accepts a number of milliseconds or a duration string.
     */
    public static Duration fromValue(Object value) {
        if (value instanceof Number number) {
            return Duration.ofMillis(number.longValue());
        }
        return parse(value == null ? null : String.valueOf(value))
            .orElseThrow(() -> new IllegalArgumentException("Duration is required"));
    }
}
