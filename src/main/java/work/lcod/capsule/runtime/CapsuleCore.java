package work.lcod.capsule.runtime;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.api.Capsule;
import work.lcod.capsule.api.CapsuleMetadata;
import work.lcod.capsule.api.CapsuleState;
import work.lcod.capsule.error.AbortException;
import work.lcod.capsule.error.CapsuleException;
import work.lcod.capsule.error.HandlerException;
import work.lcod.capsule.error.LifecycleException;
import work.lcod.capsule.stimulus.Stimulus;
import work.lcod.capsule.stimulus.StimulusBus;
import work.lcod.capsule.stimulus.StimulusListener;

/**
 * In-process dispatch engine. Owns the lifecycle state machine, resolves triggers against the registry, runs the
 * middleware chains and the handler, and fans stimuli out to local listeners.
 *
 * <p>Triggers run synchronously on the caller's thread. Every trigger gets an internal token linked to the caller's
 * token and to the engine's shutdown signal, registered under a fresh request id while {@code trigger} runs. A returned
 * stream stays linked to both signals until it is exhausted, fails or is closed.</p>
 */
public final class CapsuleCore implements Capsule {
    private static final Logger LOGGER = LoggerFactory.getLogger(CapsuleCore.class);

    private final CapsuleDefinition definition;
    private final CapabilityRegistry registry;
    private final StimulusBus bus = new StimulusBus();
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong requestCounter = new AtomicLong();
    private final CancellationToken shutdownToken = new CancellationToken();
    private final Object lifecycleLock = new Object();
    private final String instanceId = UUID.randomUUID().toString();
    private volatile CapsuleState state = CapsuleState.CREATED;

    public CapsuleCore(CapsuleDefinition definition) {
        this.definition = definition;
        this.registry = new CapabilityRegistry(definition.capabilities());
    }

    public CapsuleDefinition definition() {
        return definition;
    }

    @Override
    public CapsuleMetadata describe() {
        var senses = new ArrayList<CapsuleMetadata.SenseInfo>();
        for (var sense : definition.senses()) {
            senses.add(new CapsuleMetadata.SenseInfo(sense.name(), sense.docs(), sense.signature()));
        }
        return new CapsuleMetadata(instanceId, definition.name(), definition.docs(), registry.describe(), senses);
    }

    @Override
    public CapsuleState state() {
        return state;
    }

    @Override
    public void boot() {
        synchronized (lifecycleLock) {
            switch (state) {
                case BOOTED -> {
                    return;
                }
                case SHUTDOWN -> throw LifecycleException.of("boot", state.wireName());
                case CREATED -> {
                    runHook(definition.bootHook());
                    state = CapsuleState.BOOTED;
                }
            }
        }
        LOGGER.debug("Capsule '{}' booted", definition.name());
    }

    /**
     * Cancels every in-flight invocation with reason {@code system}, runs the shutdown hook and moves to
     * {@code shutdown} even if the hook fails. Handlers that ignore their token are not waited for.
     */
    @Override
    public void shutdown() {
        synchronized (lifecycleLock) {
            switch (state) {
                case SHUTDOWN -> {
                    return;
                }
                case CREATED -> throw LifecycleException.of("shutdown", state.wireName());
                case BOOTED -> {
                    shutdownToken.cancel(CancellationToken.REASON_SYSTEM);
                    for (var token : inFlight.values()) {
                        token.cancel(CancellationToken.REASON_SYSTEM);
                    }
                    try {
                        runHook(definition.shutdownHook());
                    } finally {
                        state = CapsuleState.SHUTDOWN;
                    }
                }
            }
        }
        LOGGER.debug("Capsule '{}' shut down", definition.name());
    }

    @Override
    public Object trigger(String capability, String operation, Object params, CancellationToken callerToken) {
        var current = state;
        if (current != CapsuleState.BOOTED || shutdownToken.isCancelled()) {
            throw LifecycleException.of(
                "trigger",
                current == CapsuleState.BOOTED ? CapsuleState.SHUTDOWN.wireName() : current.wireName()
            );
        }
        var op = registry.resolve(capability, operation);
        if (callerToken != null && callerToken.isCancelled()) {
            throw new AbortException("Operation aborted before execution", callerToken.reason());
        }

        var requestId = "req-" + requestCounter.incrementAndGet();
        var token = new CancellationToken();
        var unlinkCaller = token.link(callerToken);
        var unlinkShutdown = token.link(shutdownToken);
        inFlight.put(requestId, token);
        var detached = new AtomicBoolean(false);
        Runnable detach = () -> {
            if (detached.compareAndSet(false, true)) {
                unlinkCaller.run();
                unlinkShutdown.run();
            }
        };

        boolean handedOff = false;
        try {
            var finalParams = MiddlewarePipeline.run(
                definition.middleware(),
                op.middleware(),
                new InvocationContext(capability, operation, params, token)
            );
            var ctx = new OperationContext(capability, operation, finalParams, token, this::emit);
            Object result;
            try {
                result = op.handler().handle(ctx);
            } catch (CapsuleException ex) {
                throw ex;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw HandlerException.wrap(ex);
            } catch (Exception ex) {
                throw HandlerException.wrap(ex);
            }
            if (op.kind() == OperationKind.STREAM) {
                var stream = adaptStream(capability, operation, result, detach);
                handedOff = true;
                return stream;
            }
            return result;
        } finally {
            inFlight.remove(requestId);
            // a returned stream keeps its cancellation links until it finishes
            if (!handedOff) {
                detach.run();
            }
        }
    }

    /**
     * Publishes to local listeners when booted; otherwise the stimulus is dropped.
     */
    @Override
    public void emit(Stimulus stimulus) {
        if (state != CapsuleState.BOOTED) {
            LOGGER.trace("Dropping stimulus '{}' while capsule is {}", stimulus.sense(), state);
            return;
        }
        bus.publish(stimulus.stamped());
    }

    @Override
    public Runnable onStimulus(StimulusListener listener) {
        return bus.subscribe(listener);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private CapsuleStream adaptStream(String capability, String operation, Object result, Runnable onFinish) {
        if (result instanceof StreamBridge bridge) {
            bridge.onFinish(onFinish);
            return bridge;
        }
        Iterator<?> iterator;
        if (result instanceof Iterator<?> it) {
            iterator = it;
        } else if (result instanceof Iterable<?> iterable) {
            iterator = iterable.iterator();
        } else {
            throw new HandlerException(
                "Stream operation " + capability + "." + operation + " did not return a sequence"
            );
        }
        return new IteratorStream(iterator, onFinish);
    }

    private void runHook(LifecycleHook hook) {
        if (hook == null) {
            return;
        }
        var ctx = new LifecycleContext(bus::publish);
        try {
            hook.run(ctx);
        } catch (CapsuleException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw HandlerException.wrap(ex);
        } catch (Exception ex) {
            throw HandlerException.wrap(ex);
        } finally {
            ctx.close();
        }
    }
}
