package work.lcod.capsule.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts and log level shared by the remote facade, the protocol runner and the CLI.
 *
 * @param bootTimeout     how long a remote facade waits for the boot response
 * @param shutdownTimeout how long a remote facade waits for the shutdown response before tearing the transport down
 * @param drainTimeout    how long a protocol runner waits for in-flight triggers after shutdown
 */
public record CapsuleConfig(
    Duration bootTimeout,
    Duration shutdownTimeout,
    Duration drainTimeout,
    LogLevel logLevel
) {
    public static final Duration DEFAULT_BOOT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    public CapsuleConfig {
        Objects.requireNonNull(bootTimeout, "bootTimeout");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(logLevel, "logLevel");
        requirePositive(bootTimeout, "bootTimeout");
        requirePositive(shutdownTimeout, "shutdownTimeout");
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must not be negative");
        }
    }

    public static CapsuleConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .bootTimeout(bootTimeout)
            .shutdownTimeout(shutdownTimeout)
            .drainTimeout(drainTimeout)
            .logLevel(logLevel);
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static final class Builder {
        private Duration bootTimeout = DEFAULT_BOOT_TIMEOUT;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder bootTimeout(Duration bootTimeout) {
            this.bootTimeout = bootTimeout;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CapsuleConfig build() {
            return new CapsuleConfig(bootTimeout, shutdownTimeout, drainTimeout, logLevel);
        }
    }
}
