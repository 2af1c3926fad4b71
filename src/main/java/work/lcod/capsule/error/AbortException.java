package work.lcod.capsule.error;

/**
 * Failure caused by a cancelled token. {@link #reason()} is the cancellation reason
 * ({@code "user"}, {@code "system"} on shutdown, or whatever the caller supplied).
 */
public final class AbortException extends CapsuleException {
    public static final String CODE = "aborted";

    private final String reason;

    public AbortException(String message, String reason) {
        super(CODE, message);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
