package work.lcod.capsule.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.capsule.error.HandlerException;
import work.lcod.capsule.error.MiddlewareRejectedException;
import work.lcod.capsule.error.ValidationException;

class MiddlewarePipelineTest {
    private final List<String> seen = new ArrayList<>();

    private InvocationContext context(Object params) {
        return new InvocationContext("cap", "op", params, new CancellationToken());
    }

    private Middleware recording(String name) {
        return ctx -> {
            seen.add(name + ":" + ctx.params());
            return MiddlewareResult.accept();
        };
    }

    @Test
    void runsCapsuleChainBeforeOperationChainInOrder() {
        var result = MiddlewarePipeline.run(
            List.of(recording("c1"), recording("c2")),
            List.of(recording("o1")),
            context("p")
        );
        assertEquals("p", result);
        assertEquals(List.of("c1:p", "c2:p", "o1:p"), seen);
    }

    @Test
    void transformIsVisibleToLaterSteps() {
        Middleware transform = ctx -> MiddlewareResult.transform(Map.of("admin", true));
        var result = MiddlewarePipeline.run(
            List.of(recording("before"), transform, recording("after")),
            List.of(),
            context(Map.of())
        );
        assertEquals(Map.of("admin", true), result);
        assertEquals(List.of("before:{}", "after:{admin=true}"), seen);
    }

    @Test
    void rejectStopsTheChain() {
        Middleware reject = ctx -> MiddlewareResult.reject("Unauthorized");
        var error = assertThrows(
            MiddlewareRejectedException.class,
            () -> MiddlewarePipeline.run(List.of(recording("first"), reject), List.of(recording("op")), context("p"))
        );
        assertEquals("Unauthorized", error.reason());
        assertEquals("Rejected by middleware: Unauthorized", error.getMessage());
        assertEquals(List.of("first:p"), seen);
    }

    @Test
    void nullResultIsAContractViolation() {
        Middleware broken = ctx -> null;
        var error = assertThrows(
            HandlerException.class,
            () -> MiddlewarePipeline.run(List.of(broken), List.of(), context("p"))
        );
        assertEquals(HandlerException.CODE, error.code());
        assertEquals("Middleware for cap.op returned no result", error.getMessage());
    }

    @Test
    void thrownErrorsAbortTheChain() {
        Middleware failing = ctx -> {
            throw new IllegalArgumentException("bad params");
        };
        var error = assertThrows(
            HandlerException.class,
            () -> MiddlewarePipeline.run(List.of(failing, recording("later")), List.of(), context("p"))
        );
        assertEquals("bad params", error.getMessage());
        assertEquals(List.of(), seen);
    }

    @Test
    void capsuleErrorsPassThroughUnchanged() {
        var original = new ValidationException("missing field");
        Middleware failing = ctx -> {
            throw original;
        };
        var error = assertThrows(
            ValidationException.class,
            () -> MiddlewarePipeline.run(List.of(), List.of(failing), context("p"))
        );
        assertSame(original, error);
    }
}
