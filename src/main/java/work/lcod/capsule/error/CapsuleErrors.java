package work.lcod.capsule.error;

import java.util.Locale;

/**
 * Maps exceptions to their wire form ({@code error} text plus {@code errorCode}) and back, so a failure raised in a
 * remote capsule surfaces as the same exception type the local engine would have thrown.
 */
public final class CapsuleErrors {
    private static final String REJECTED_PREFIX = "Rejected by middleware: ";
    private static final String STATE_MARKER = "capsule is ";

    private CapsuleErrors() {}

    public static CapsuleException normalize(Throwable error) {
        if (error instanceof CapsuleException ce) {
            return ce;
        }
        if (error == null) {
            return new HandlerException("Unexpected error");
        }
        return HandlerException.wrap(error);
    }

    public static String message(Throwable error) {
        if (error == null) {
            return "Unexpected error";
        }
        var message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    public static String code(Throwable error) {
        return normalize(error).code();
    }

    /**
     * Rebuilds a typed exception from the text and optional code received from a peer.
     */
    public static CapsuleException fromWire(String code, String message) {
        String text = message == null || message.isBlank() ? "Remote operation failed" : message;
        String effective = code;
        if (effective == null || effective.isBlank()) {
            effective = text.toLowerCase(Locale.ROOT).contains("aborted") ? AbortException.CODE : HandlerException.CODE;
        }
        return switch (effective) {
            case ValidationException.CODE -> new ValidationException(text);
            case LifecycleException.CODE -> new LifecycleException(text, stateOf(text));
            case MiddlewareRejectedException.CODE -> new MiddlewareRejectedException(
                text.startsWith(REJECTED_PREFIX) ? text.substring(REJECTED_PREFIX.length()) : text
            );
            case AbortException.CODE -> new AbortException(text, reasonOf(text));
            case ProtocolException.CODE -> new ProtocolException(text);
            case TransportException.CODE -> new TransportException(text);
            default -> new HandlerException(text);
        };
    }

    private static String stateOf(String text) {
        int idx = text.lastIndexOf(STATE_MARKER);
        if (idx < 0) {
            return "unknown";
        }
        return text.substring(idx + STATE_MARKER.length()).trim();
    }

    private static String reasonOf(String text) {
        int open = text.lastIndexOf('(');
        if (open >= 0 && text.endsWith(")")) {
            return text.substring(open + 1, text.length() - 1);
        }
        return "remote";
    }
}
