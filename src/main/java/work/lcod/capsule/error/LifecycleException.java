package work.lcod.capsule.error;

/**
 * Raised when boot, trigger or shutdown is called in a lifecycle state that does not allow it.
 * The offending state name ({@code created}, {@code booted}, {@code shutdown}) is kept for diagnostics.
 */
public final class LifecycleException extends CapsuleException {
    public static final String CODE = "lifecycle";

    private final String state;

    public LifecycleException(String message, String state) {
        super(CODE, message);
        this.state = state;
    }

    public static LifecycleException of(String action, String state) {
        return new LifecycleException("Cannot " + action + ": capsule is " + state, state);
    }

    public String state() {
        return state;
    }
}
