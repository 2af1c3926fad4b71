package work.lcod.capsule.api;

import java.util.Locale;

/**
 * Lifecycle of a capsule instance. Transitions only move forward: created, booted, shutdown.
 */
public enum CapsuleState {
    CREATED,
    BOOTED,
    SHUTDOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return wireName();
    }
}
