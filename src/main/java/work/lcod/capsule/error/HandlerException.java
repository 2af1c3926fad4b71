package work.lcod.capsule.error;

/**
 * Wraps whatever an operation handler or a middleware step threw. The original throwable is the cause and its
 * message is reused, so callers see the handler's own wording.
 */
public final class HandlerException extends CapsuleException {
    public static final String CODE = "handler";

    public HandlerException(String message) {
        super(CODE, message);
    }

    public HandlerException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    public static HandlerException wrap(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        return new HandlerException(message, cause);
    }
}
