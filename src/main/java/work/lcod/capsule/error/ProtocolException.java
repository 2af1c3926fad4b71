package work.lcod.capsule.error;

/**
 * Malformed line, unexpected message type or unknown correlation id. When the offending input still carried a
 * request id, {@link #requestId()} exposes it so the runner can answer with an error response.
 */
public final class ProtocolException extends CapsuleException {
    public static final String CODE = "protocol";

    private final String requestId;

    public ProtocolException(String message) {
        this(message, null, null);
    }

    public ProtocolException(String message, String requestId, Throwable cause) {
        super(CODE, message, cause);
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }
}
