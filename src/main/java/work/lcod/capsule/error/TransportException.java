package work.lcod.capsule.error;

/**
 * The byte stream to the peer ended or failed. A remote facade that raised this is no longer usable.
 */
public final class TransportException extends CapsuleException {
    public static final String CODE = "transport";

    public TransportException(String message) {
        super(CODE, message);
    }

    public TransportException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
