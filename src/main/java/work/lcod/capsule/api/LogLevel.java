package work.lcod.capsule.api;

import ch.qos.logback.classic.Level;
import java.util.Locale;

/**
 * Log levels accepted by the CLI and the configuration file.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    OFF(Level.OFF);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    public Level logbackLevel() {
        return logbackLevel;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
