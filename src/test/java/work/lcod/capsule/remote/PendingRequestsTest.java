package work.lcod.capsule.remote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;
import work.lcod.capsule.error.TransportException;
import work.lcod.capsule.protocol.ProtocolMessage;

class PendingRequestsTest {
    @Test
    void resolvesEachIdOnce() throws Exception {
        var pending = new PendingRequests();
        var future = pending.register("trigger-1");
        var response = ProtocolMessage.Response.success("trigger-1", 3);

        assertTrue(pending.resolve("trigger-1", response));
        assertFalse(pending.resolve("trigger-1", response));
        assertSame(response, future.get());
        assertEquals(0, pending.size());
    }

    @Test
    void duplicateRegistrationIsRejected() {
        var pending = new PendingRequests();
        pending.register("boot");

        assertThrows(IllegalStateException.class, () -> pending.register("boot"));
    }

    @Test
    void failAllRejectsEveryOutstandingRequest() {
        var pending = new PendingRequests();
        var first = pending.register("trigger-1");
        var second = pending.register("trigger-2");
        var failure = new TransportException("gone");

        pending.failAll(failure);

        var error = assertThrows(ExecutionException.class, first::get);
        assertSame(failure, error.getCause());
        assertTrue(second.isCompletedExceptionally());
        assertEquals(0, pending.size());
    }

    @Test
    void discardedRequestsAreNoLongerResolvable() {
        var pending = new PendingRequests();
        var future = pending.register("shutdown");

        pending.discard("shutdown");

        assertFalse(pending.resolve("shutdown", ProtocolMessage.ShutdownResponse.succeeded()));
        assertFalse(future.isDone());
    }
}
