package work.lcod.capsule.runtime;

/**
 * What a middleware sees of an in-flight trigger: names, the current params and the token. It offers
 * no way to emit stimuli or call other operations.
 */
public record InvocationContext(String capability, String operation, Object params, CancellationToken token) {
    InvocationContext withParams(Object newParams) {
        return new InvocationContext(capability, operation, newParams, token);
    }
}
