package work.lcod.capsule.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class CapsuleErrorsTest {
    @Test
    void normalizeKeepsCapsuleExceptionsAndWrapsTheRest() {
        var validation = new ValidationException("Unknown capability: nope");
        assertSame(validation, CapsuleErrors.normalize(validation));

        var wrapped = CapsuleErrors.normalize(new IllegalArgumentException("bad input"));
        assertInstanceOf(HandlerException.class, wrapped);
        assertEquals("bad input", wrapped.getMessage());

        assertEquals("NullPointerException", CapsuleErrors.message(new NullPointerException()));
    }

    @Test
    void wireCodesRebuildTheMatchingType() {
        var lifecycle = assertInstanceOf(LifecycleException.class,
            CapsuleErrors.fromWire("lifecycle", "Cannot trigger: capsule is shutdown"));
        assertEquals("shutdown", lifecycle.state());

        var rejected = assertInstanceOf(MiddlewareRejectedException.class,
            CapsuleErrors.fromWire("rejected", "Rejected by middleware: Unauthorized"));
        assertEquals("Unauthorized", rejected.reason());
        assertEquals("Rejected by middleware: Unauthorized", rejected.getMessage());

        var aborted = assertInstanceOf(AbortException.class,
            CapsuleErrors.fromWire("aborted", "Operation aborted: slow.wait (user)"));
        assertEquals("user", aborted.reason());

        assertInstanceOf(ValidationException.class, CapsuleErrors.fromWire("validation", "Unknown operation: a.b"));
        assertInstanceOf(ProtocolException.class, CapsuleErrors.fromWire("protocol", "Protocol error: x"));
        assertInstanceOf(TransportException.class, CapsuleErrors.fromWire("transport", "closed"));
    }

    @Test
    void missingCodeFallsBackOnTheMessageText() {
        assertInstanceOf(AbortException.class, CapsuleErrors.fromWire(null, "Operation aborted before execution"));
        var handler = assertInstanceOf(HandlerException.class, CapsuleErrors.fromWire(null, "Division by zero"));
        assertEquals("Division by zero", handler.getMessage());
        assertEquals("Remote operation failed", CapsuleErrors.fromWire("handler", null).getMessage());
    }
}
