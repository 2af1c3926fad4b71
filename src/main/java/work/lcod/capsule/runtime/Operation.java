package work.lcod.capsule.runtime;

import java.util.List;
import java.util.Objects;

/**
 * One invocable unit of a capability.
 *
 * @param signature free-form description of params and result, exposed through {@code describe()}
 * @param handler   for stream operations, returns the iterator produced by the {@link StreamHandler}
 */
public record Operation(
    String name,
    String docs,
    String signature,
    OperationKind kind,
    List<Middleware> middleware,
    OperationHandler handler
) {
    public Operation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
        middleware = middleware == null ? List.of() : List.copyOf(middleware);
    }

    public static Operation call(String name, OperationHandler handler) {
        return new Operation(name, null, null, OperationKind.CALL, List.of(), handler);
    }

    public static Operation stream(String name, StreamHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return new Operation(name, null, null, OperationKind.STREAM, List.of(), handler::open);
    }

    public Operation withDocs(String newDocs) {
        return new Operation(name, newDocs, signature, kind, middleware, handler);
    }

    public Operation withSignature(String newSignature) {
        return new Operation(name, docs, newSignature, kind, middleware, handler);
    }

    public Operation withMiddleware(Middleware... chain) {
        return new Operation(name, docs, signature, kind, List.of(chain), handler);
    }
}
