package work.lcod.capsule.runtime;

import java.util.Iterator;

/**
 * Handler of a {@link OperationKind#STREAM} operation. The returned iterator is consumed lazily by the caller; it may
 * block in {@code hasNext()} and may throw mid-sequence. Handlers producing on another thread can return a
 * {@link StreamBridge}.
 */
@FunctionalInterface
public interface StreamHandler {
    Iterator<?> open(OperationContext ctx) throws Exception;
}
