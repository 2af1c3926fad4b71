package work.lcod.capsule.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import work.lcod.capsule.runtime.Capability;
import work.lcod.capsule.runtime.CapsuleDefinition;
import work.lcod.capsule.runtime.CapsuleStream;
import work.lcod.capsule.runtime.MiddlewareResult;
import work.lcod.capsule.runtime.Operation;
import work.lcod.capsule.runtime.OperationContext;
import work.lcod.capsule.stimulus.Stimulus;
import work.lcod.capsule.stimulus.StimulusListener;

/**
 * Shared fixtures for the engine, protocol and facade suites.
 */
public final class CapsuleTestSupport {
    public static final String EVENT_SENSE = "test:event";

    private CapsuleTestSupport() {}

    /**
     * Capsule used by the contract suites:
     * <ul>
     *   <li>{@code math.add}, {@code math.fail}</li>
     *   <li>{@code numbers.upTo {to}} lazy stream, {@code numbers.failAfterOne}</li>
     *   <li>{@code slow.ignore {ms}} sleeps ignoring its token, {@code slow.wait} waits for cancellation</li>
     *   <li>{@code events.emit} emits its params as {@value #EVENT_SENSE}</li>
     * </ul>
     *
     * @param handlerCalls incremented by every handler invocation
     */
    public static CapsuleDefinition testDefinition(AtomicInteger handlerCalls) {
        return CapsuleDefinition.builder("test")
            .capability(Capability.of(
                "math",
                Operation.call("add", ctx -> {
                    handlerCalls.incrementAndGet();
                    return number(ctx, "a") + number(ctx, "b");
                }),
                Operation.call("fail", ctx -> {
                    handlerCalls.incrementAndGet();
                    throw new IllegalStateException("boom");
                })
            ))
            .capability(Capability.of(
                "numbers",
                Operation.stream("upTo", ctx -> {
                    handlerCalls.incrementAndGet();
                    return upTo(ctx, number(ctx, "to"));
                }),
                Operation.stream("failAfterOne", ctx -> {
                    handlerCalls.incrementAndGet();
                    return failAfterOne();
                })
            ))
            .capability(Capability.of(
                "slow",
                Operation.call("ignore", ctx -> {
                    handlerCalls.incrementAndGet();
                    Thread.sleep(number(ctx, "ms"));
                    return "done";
                }),
                Operation.call("wait", ctx -> {
                    handlerCalls.incrementAndGet();
                    long deadline = System.currentTimeMillis() + 5_000;
                    while (!ctx.isCancelled() && System.currentTimeMillis() < deadline) {
                        Thread.sleep(10);
                    }
                    ctx.token().throwIfCancelled();
                    return "not cancelled";
                })
            ))
            .capability(Capability.of(
                "events",
                Operation.call("emit", ctx -> {
                    handlerCalls.incrementAndGet();
                    ctx.emit(EVENT_SENSE, ctx.params());
                    return true;
                })
            ))
            .sense(EVENT_SENSE, "Params of events.emit.", "any")
            .build();
    }

    /**
     * Capsule whose only middleware rejects every trigger whose params lack {@code admin: true}.
     */
    public static CapsuleDefinition guardedDefinition(AtomicInteger handlerCalls) {
        return CapsuleDefinition.builder("guarded")
            .middleware(ctx -> ctx.params() instanceof Map<?, ?> map && Boolean.TRUE.equals(map.get("admin"))
                ? MiddlewareResult.accept()
                : MiddlewareResult.reject("Unauthorized"))
            .capability(Capability.of(
                "vault",
                Operation.call("open", ctx -> {
                    handlerCalls.incrementAndGet();
                    return "opened";
                })
            ))
            .build();
    }

    public static long number(OperationContext ctx, String key) {
        var raw = ctx.param(key);
        if (raw instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalArgumentException("Missing numeric parameter '" + key + "'");
    }

    public static List<Long> drain(CapsuleStream stream) {
        var items = new ArrayList<Long>();
        while (stream.hasNext()) {
            items.add(((Number) stream.next()).longValue());
        }
        return items;
    }

    public static void awaitCondition(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout.toMillis() + " ms");
            }
            Thread.sleep(5);
        }
    }

    public static RecordingListener recorder() {
        return new RecordingListener();
    }

    private static Iterator<Long> upTo(OperationContext ctx, long to) {
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

    private static Iterator<Long> failAfterOne() {
        return new Iterator<>() {
            private boolean served;

            @Override
            public boolean hasNext() {
                if (served) {
                    throw new IllegalStateException("source exploded");
                }
                return true;
            }

            @Override
            public Long next() {
                served = true;
                return 1L;
            }
        };
    }

    public static final class RecordingListener implements StimulusListener {
        private final List<Stimulus> received = new CopyOnWriteArrayList<>();

        @Override
        public void onStimulus(Stimulus stimulus) {
            received.add(stimulus);
        }

        public List<Stimulus> received() {
            return received;
        }

        public List<Stimulus> ofSense(String sense) {
            return received.stream().filter(s -> s.sense().equals(sense)).toList();
        }
    }
}
