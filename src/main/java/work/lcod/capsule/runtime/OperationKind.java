package work.lcod.capsule.runtime;

import java.util.Locale;

/**
 * Execution shape of an operation: a single result or a lazy sequence of results.
 */
public enum OperationKind {
    CALL,
    STREAM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
