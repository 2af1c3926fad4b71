package work.lcod.capsule.remote;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.protocol.ProtocolMessage;

/**
 * Requests awaiting their answer, keyed by correlation id. Every entry is removed exactly once, by whichever of
 * resolve, reject, discard or failAll gets to it first.
 */
final class PendingRequests {
    private static final Logger LOGGER = LoggerFactory.getLogger(PendingRequests.class);

    private final Map<String, CompletableFuture<ProtocolMessage>> pending = new ConcurrentHashMap<>();

    CompletableFuture<ProtocolMessage> register(String id) {
        var future = new CompletableFuture<ProtocolMessage>();
        if (pending.putIfAbsent(id, future) != null) {
            throw new IllegalStateException("Request '" + id + "' is already pending");
        }
        return future;
    }

    /**
     * @return {@code false} when nothing was waiting for this id
     */
    boolean resolve(String id, ProtocolMessage message) {
        var future = pending.remove(id);
        if (future == null) {
            return false;
        }
        future.complete(message);
        return true;
    }

    boolean reject(String id, Throwable error) {
        var future = pending.remove(id);
        if (future == null) {
            return false;
        }
        future.completeExceptionally(error);
        LOGGER.debug("Rejected request {}: {}", id, error.getMessage());
        return true;
    }

    void discard(String id) {
        pending.remove(id);
    }

    void failAll(Throwable error) {
        for (var id : new ArrayList<>(pending.keySet())) {
            reject(id, error);
        }
    }

    int size() {
        return pending.size();
    }
}
