package work.lcod.capsule.error;

/**
 * Base type of every failure raised by the dispatch engine, the protocol layer and the remote facade.
 * Each subtype carries a stable {@link #code()} that also travels over the wire.
 */
public abstract class CapsuleException extends RuntimeException {
    private final String code;

    protected CapsuleException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected CapsuleException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
