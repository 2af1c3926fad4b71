package work.lcod.capsule.runtime;

import java.util.Objects;

/**
 * Outcome of one middleware step: accept unchanged, transform the params, or reject the invocation.
 */
public final class MiddlewareResult {
    public enum Type {
        ACCEPT,
        TRANSFORM,
        REJECT
    }

    private static final MiddlewareResult ACCEPTED = new MiddlewareResult(Type.ACCEPT, null, null);

    private final Type type;
    private final Object params;
    private final String reason;

    private MiddlewareResult(Type type, Object params, String reason) {
        this.type = type;
        this.params = params;
        this.reason = reason;
    }

    public static MiddlewareResult accept() {
        return ACCEPTED;
    }

    public static MiddlewareResult transform(Object params) {
        return new MiddlewareResult(Type.TRANSFORM, params, null);
    }

    public static MiddlewareResult reject(String reason) {
        return new MiddlewareResult(Type.REJECT, null, Objects.requireNonNull(reason, "reason"));
    }

    public Type type() {
        return type;
    }

    /**
     * Replacement params; only meaningful for {@link Type#TRANSFORM}.
     */
    public Object params() {
        return params;
    }

    /**
     * Rejection reason; only meaningful for {@link Type#REJECT}.
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return switch (type) {
            case ACCEPT -> "accept";
            case TRANSFORM -> "transform(" + params + ")";
            case REJECT -> "reject(" + reason + ")";
        };
    }
}
