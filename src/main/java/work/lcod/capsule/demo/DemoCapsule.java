package work.lcod.capsule.demo;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import work.lcod.capsule.api.CapsuleProvider;
import work.lcod.capsule.runtime.Capability;
import work.lcod.capsule.runtime.CapsuleDefinition;
import work.lcod.capsule.runtime.MiddlewareResult;
import work.lcod.capsule.runtime.Operation;
import work.lcod.capsule.runtime.OperationContext;
import work.lcod.capsule.runtime.StreamBridge;

/**
 * Small capsule served by {@code capsule serve demo}; exercises call and stream operations, middleware, stimuli and
 * the lifecycle hooks.
 */
public final class DemoCapsule implements CapsuleProvider {
    public static final String NAME = "demo";
    public static final String LIFECYCLE_SENSE = "demo:lifecycle";
    public static final String TICK_SENSE = "counter:tick";
    public static final String ANNOUNCE_SENSE = "demo:announce";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CapsuleDefinition definition() {
        return CapsuleDefinition.builder(NAME)
            .docs("Demo capsule used by the CLI and the integration tests.")
            .middleware(ctx -> ctx.params() instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get("deny"))
                ? MiddlewareResult.reject("Denied by request")
                : MiddlewareResult.accept())
            .capability(Capability.of(
                "math",
                Operation.call("add", DemoCapsule::add).withSignature("{a: number, b: number} -> number"),
                Operation.call("divide", DemoCapsule::divide).withSignature("{a: number, b: number} -> number")
            ).withDocs("Arithmetic."))
            .capability(Capability.of(
                "counter",
                Operation.stream("count", DemoCapsule::count)
                    .withDocs("Counts from 1 to `to`.")
                    .withSignature("{to: number} -> stream<number>"),
                Operation.stream("ticks", DemoCapsule::ticks)
                    .withDocs("Produces `count` ticks from a background thread, one every `intervalMs`.")
                    .withSignature("{count: number, intervalMs: number} -> stream<number>")
            ))
            .capability(Capability.of(
                "system",
                Operation.call("echo", OperationContext::params).withDocs("Returns its params."),
                Operation.call("sleep", DemoCapsule::sleep).withDocs("Sleeps `ms` milliseconds, ignoring cancellation."),
                Operation.call("announce", DemoCapsule::announce).withDocs("Emits its params as a demo:announce stimulus.")
            ))
            .sense(LIFECYCLE_SENSE, "Boot and shutdown of the demo capsule.", "{phase: string}")
            .sense(TICK_SENSE, "One per tick produced by counter.ticks.", "{tick: number}")
            .sense(ANNOUNCE_SENSE, "Params of system.announce.", "any")
            .onBoot(ctx -> ctx.emit(LIFECYCLE_SENSE, Map.of("phase", "boot")))
            .onShutdown(ctx -> ctx.emit(LIFECYCLE_SENSE, Map.of("phase", "shutdown")))
            .build();
    }

    private static Object add(OperationContext ctx) {
        var a = number(ctx, "a");
        var b = number(ctx, "b");
        if (isIntegral(a) && isIntegral(b)) {
            return a.longValue() + b.longValue();
        }
        return a.doubleValue() + b.doubleValue();
    }

    private static Object divide(OperationContext ctx) {
        var a = number(ctx, "a");
        var b = number(ctx, "b");
        if (b.doubleValue() == 0d) {
            throw new ArithmeticException("Division by zero");
        }
        return a.doubleValue() / b.doubleValue();
    }

    private static Iterator<Long> count(OperationContext ctx) {
        long to = number(ctx, "to").longValue();
        return new Iterator<>() {
            private long next = 1;

            @Override
            public boolean hasNext() {
                return next <= to && !ctx.isCancelled();
            }

            @Override
            public Long next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return next++;
            }
        };
    }

    private static StreamBridge ticks(OperationContext ctx) {
        long count = number(ctx, "count").longValue();
        long interval = ctx.param("intervalMs") == null ? 10L : number(ctx, "intervalMs").longValue();
        var bridge = new StreamBridge();
        var producer = new Thread(() -> {
            try {
                for (long tick = 1; tick <= count; tick++) {
                    if (ctx.isCancelled() || bridge.isFinished()) {
                        break;
                    }
                    ctx.emit(TICK_SENSE, Map.of("tick", tick));
                    bridge.pushData(tick);
                    Thread.sleep(interval);
                }
                bridge.pushEnd();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                bridge.pushEnd();
            }
        }, "demo-ticks");
        producer.setDaemon(true);
        producer.start();
        return bridge;
    }

    private static Object sleep(OperationContext ctx) throws InterruptedException {
        long ms = number(ctx, "ms").longValue();
        Thread.sleep(ms);
        var result = new LinkedHashMap<String, Object>();
        result.put("slept", ms);
        return result;
    }

    private static Object announce(OperationContext ctx) {
        ctx.emit(ANNOUNCE_SENSE, ctx.params());
        return true;
    }

    private static Number number(OperationContext ctx, String key) {
        var raw = ctx.param(key);
        if (raw instanceof Number number) {
            return number;
        }
        if (raw instanceof String str && !str.isBlank()) {
            try {
                return Double.parseDouble(str.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Parameter '" + key + "' is not a number: " + str);
            }
        }
        throw new IllegalArgumentException("Missing numeric parameter '" + key + "'");
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }
}
