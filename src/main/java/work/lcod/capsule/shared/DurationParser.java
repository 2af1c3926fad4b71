package work.lcod.capsule.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses user-friendly durations such as {@code 500ms}, {@code 2s}, {@code 1m} or {@code 1h}. A bare number is read
 * as milliseconds.
 */
public final class DurationParser {
    private static final Pattern FORMAT = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        return parse(raw, "duration");
    }

    /**
     * @param key named in the error message, typically the option or config key the value came from
     * @throws IllegalArgumentException when the value is not a non-negative duration
     */
    public static Optional<Duration> parse(String raw, String key) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = FORMAT.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid " + key + ": '" + raw + "' (expected e.g. 500ms, 2s, 1m, 1h)");
        }
        long value;
        try {
            value = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + key + ": '" + raw + "' is out of range");
        }
        var unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        return Optional.of(switch (unit) {
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            default -> Duration.ofMillis(value);
        });
    }

    public static Duration parseOrDefault(String raw, String key, Duration fallback) {
        return parse(raw, key).orElse(fallback);
    }
}
