package work.lcod.capsule.runtime;

/**
 * Handler of a {@link OperationKind#CALL} operation.
 */
@FunctionalInterface
public interface OperationHandler {
    Object handle(OperationContext ctx) throws Exception;
}
