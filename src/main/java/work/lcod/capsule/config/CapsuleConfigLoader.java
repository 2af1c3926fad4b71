package work.lcod.capsule.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.capsule.api.CapsuleConfig;
import work.lcod.capsule.api.LogLevel;
import work.lcod.capsule.shared.DurationParser;

/**
 * Reads {@link CapsuleConfig} overrides from a TOML file:
 *
 * <pre>
 * log_level = "debug"
 * [remote]
 * boot_timeout = "10s"
 * shutdown_timeout = "2s"
 * [runner]
 * drain_timeout = "5s"
 * </pre>
 *
 * Keys that are absent keep the value of the base configuration. Durations are strings with a unit or integers in
 * milliseconds.
 */
public final class CapsuleConfigLoader {
    static final String LOG_LEVEL = "log_level";
    static final String BOOT_TIMEOUT = "remote.boot_timeout";
    static final String SHUTDOWN_TIMEOUT = "remote.shutdown_timeout";
    static final String DRAIN_TIMEOUT = "runner.drain_timeout";

    private CapsuleConfigLoader() {}

    public static CapsuleConfig load(Path path) {
        return load(path, CapsuleConfig.defaults());
    }

    public static CapsuleConfig load(Path path, CapsuleConfig base) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        try {
            return parse(Files.readString(path), path.toString(), base);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read configuration " + path, ex);
        }
    }

    public static CapsuleConfig parse(String toml, String sourceName, CapsuleConfig base) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + sourceName + ": " + errors);
        }
        var builder = base.toBuilder();
        if (result.contains(LOG_LEVEL)) {
            builder.logLevel(LogLevel.from(requireString(result, LOG_LEVEL)));
        }
        builder.bootTimeout(duration(result, BOOT_TIMEOUT, base.bootTimeout()));
        builder.shutdownTimeout(duration(result, SHUTDOWN_TIMEOUT, base.shutdownTimeout()));
        builder.drainTimeout(duration(result, DRAIN_TIMEOUT, base.drainTimeout()));
        return builder.build();
    }

    private static Duration duration(TomlParseResult result, String key, Duration fallback) {
        if (!result.contains(key)) {
            return fallback;
        }
        if (result.isLong(key)) {
            long millis = result.getLong(key);
            if (millis < 0) {
                throw new IllegalArgumentException("Invalid " + key + ": must not be negative");
            }
            return Duration.ofMillis(millis);
        }
        return DurationParser.parseOrDefault(requireString(result, key), key, fallback);
    }

    private static String requireString(TomlParseResult result, String key) {
        if (!result.isString(key)) {
            throw new IllegalArgumentException("Invalid " + key + ": expected a string");
        }
        return result.getString(key);
    }
}
