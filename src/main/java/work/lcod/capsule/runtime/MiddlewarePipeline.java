package work.lcod.capsule.runtime;

import java.util.List;
import work.lcod.capsule.error.CapsuleException;
import work.lcod.capsule.error.HandlerException;
import work.lcod.capsule.error.MiddlewareRejectedException;

/**
 * Runs the capsule-level chain and then the operation-level chain, strictly in list order.
 */
final class MiddlewarePipeline {
    private MiddlewarePipeline() {}

    /**
     * @return the params the handler must receive
     * @throws MiddlewareRejectedException when a step rejects; later steps and the handler do not run
     */
    static Object run(List<Middleware> capsuleLevel, List<Middleware> operationLevel, InvocationContext initial) {
        var ctx = runChain(capsuleLevel, initial);
        ctx = runChain(operationLevel, ctx);
        return ctx.params();
    }

    private static InvocationContext runChain(List<Middleware> chain, InvocationContext start) {
        var ctx = start;
        for (var middleware : chain) {
            MiddlewareResult result;
            try {
                result = middleware.apply(ctx);
            } catch (CapsuleException ex) {
                throw ex;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw HandlerException.wrap(ex);
            } catch (Exception ex) {
                throw HandlerException.wrap(ex);
            }
            if (result == null) {
                throw new HandlerException(
                    "Middleware for " + ctx.capability() + "." + ctx.operation() + " returned no result"
                );
            }
            ctx = switch (result.type()) {
                case ACCEPT -> ctx;
                case TRANSFORM -> ctx.withParams(result.params());
                case REJECT -> throw new MiddlewareRejectedException(result.reason());
            };
        }
        return ctx;
    }
}
