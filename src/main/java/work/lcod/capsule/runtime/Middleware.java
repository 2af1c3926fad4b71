package work.lcod.capsule.runtime;

/**
 * Interceptor run before an operation handler. Capsule-level middleware runs for every operation, ahead of the
 * operation's own list.
 */
@FunctionalInterface
public interface Middleware {
    MiddlewareResult apply(InvocationContext ctx) throws Exception;
}
