package work.lcod.capsule.error;

/**
 * A middleware explicitly rejected the invocation; the handler never ran.
 */
public final class MiddlewareRejectedException extends CapsuleException {
    public static final String CODE = "rejected";

    private final String reason;

    public MiddlewareRejectedException(String reason) {
        super(CODE, "Rejected by middleware: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
