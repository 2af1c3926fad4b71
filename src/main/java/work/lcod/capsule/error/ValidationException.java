package work.lcod.capsule.error;

/**
 * Raised when a trigger names a capability or operation the capsule does not expose.
 */
public final class ValidationException extends CapsuleException {
    public static final String CODE = "validation";

    public ValidationException(String message) {
        super(CODE, message);
    }

    public static ValidationException unknownCapability(String capability) {
        return new ValidationException("Unknown capability: " + capability);
    }

    public static ValidationException unknownOperation(String capability, String operation) {
        return new ValidationException("Unknown operation: " + capability + "." + operation);
    }
}
