package work.lcod.capsule.protocol;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.api.CapsuleState;
import work.lcod.capsule.error.AbortException;
import work.lcod.capsule.error.CapsuleErrors;
import work.lcod.capsule.error.LifecycleException;
import work.lcod.capsule.error.ProtocolException;
import work.lcod.capsule.error.TransportException;
import work.lcod.capsule.runtime.CancellationToken;
import work.lcod.capsule.runtime.CapsuleCore;
import work.lcod.capsule.runtime.CapsuleDefinition;
import work.lcod.capsule.runtime.CapsuleStream;

/**
 * Server side of the wire protocol: hosts one capsule engine and answers the messages of a single remote facade.
 *
 * <p>Messages are handled in arrival order on the reading thread, except triggers which run on a worker pool so
 * that an {@code abort} for a running trigger is processed while it executes. Every stimulus of the hosted engine
 * is forwarded as a {@code stimulus} message.</p>
 */
public final class ProtocolRunner implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProtocolRunner.class);

    private final CapsuleDefinition definition;
    private final MessageWriter writer;
    private final Duration drainTimeout;
    private final ExecutorService workers;
    private final Map<String, CancellationToken> inFlight = new ConcurrentHashMap<>();
    private final Object stateLock = new Object();
    private final Object outputLock = new Object();
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile CapsuleState state = CapsuleState.CREATED;
    private volatile boolean shutdownAnswered;
    private CapsuleCore capsule;
    private Runnable stimulusSubscription;

    public ProtocolRunner(CapsuleDefinition definition, MessageWriter writer, Duration drainTimeout) {
        this.definition = definition;
        this.writer = writer;
        this.drainTimeout = drainTimeout;
        var counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            var thread = new Thread(r, "capsule-trigger-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public CapsuleState state() {
        return state;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Reads messages from {@code input} until a {@code shutdown} has been answered or the input ends, then waits up
     * to the drain timeout for triggers still running. When the input ends while the capsule is booted, the capsule
     * is shut down and the shutdown response written as if a {@code shutdown} had been received.
     */
    public void serve(InputStream input, MessageCodec codec) {
        var reader = new MessageReader(input, codec, new MessageReader.Listener() {
            @Override
            public void onMessage(ProtocolMessage message) {
                handle(message);
            }

            @Override
            public void onMalformed(String line, ProtocolException error) {
                LOGGER.warn("Skipping malformed line: {}", error.getMessage());
                if (error.requestId() != null) {
                    deliver(ProtocolMessage.Response.failed(
                        error.requestId(),
                        new ProtocolException("Protocol error: " + error.getMessage())
                    ));
                }
            }

            @Override
            public void onClosed(IOException error) {
                if (error != null) {
                    LOGGER.error("Reading protocol input failed: {}", error.getMessage());
                } else {
                    LOGGER.debug("Protocol input closed");
                }
                if (state == CapsuleState.BOOTED) {
                    answerShutdown();
                }
                done.countDown();
            }
        });
        reader.start("capsule-runner-reader");
        try {
            done.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        close();
    }

    /**
     * Handles one inbound message. Responses are written to the runner's writer.
     */
    public void handle(ProtocolMessage message) {
        if (message instanceof ProtocolMessage.Boot boot) {
            handleBoot(boot);
        } else if (message instanceof ProtocolMessage.Trigger trigger) {
            handleTrigger(trigger);
        } else if (message instanceof ProtocolMessage.Abort abort) {
            handleAbort(abort);
        } else if (message instanceof ProtocolMessage.Shutdown) {
            answerShutdown();
            done.countDown();
        } else {
            LOGGER.warn("Ignoring unexpected {} message", message.type().wireName());
        }
    }

    /**
     * Shuts the hosted capsule down. Idempotent: answers {@code ok:true} again once shut down.
     */
    public ProtocolMessage.ShutdownResponse shutdown() {
        synchronized (stateLock) {
            if (state == CapsuleState.SHUTDOWN) {
                return ProtocolMessage.ShutdownResponse.succeeded();
            }
            if (state != CapsuleState.BOOTED) {
                return ProtocolMessage.ShutdownResponse.failed(LifecycleException.of("shutdown", state.wireName()));
            }
            for (var token : inFlight.values()) {
                token.cancel(CancellationToken.REASON_SYSTEM);
            }
            try {
                capsule.shutdown();
                LOGGER.debug("Capsule '{}' shut down", definition.name());
                return ProtocolMessage.ShutdownResponse.succeeded();
            } catch (RuntimeException ex) {
                LOGGER.error("Shutdown of capsule '{}' failed: {}", definition.name(), ex.getMessage(), ex);
                return ProtocolMessage.ShutdownResponse.failed(ex);
            } finally {
                state = CapsuleState.SHUTDOWN;
                stimulusSubscription.run();
            }
        }
    }

    /**
     * Stops accepting triggers and waits up to the drain timeout for running ones.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{} trigger(s) still running after {} ms drain timeout", inFlight.size(), drainTimeout.toMillis());
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void handleBoot(ProtocolMessage.Boot message) {
        synchronized (stateLock) {
            if (state != CapsuleState.CREATED) {
                deliver(ProtocolMessage.BootResponse.failed(LifecycleException.of("boot", state.wireName())));
                return;
            }
            if (message.capsuleName() != null && !message.capsuleName().equals(definition.name())) {
                LOGGER.warn("Boot requested capsule '{}' but this runner hosts '{}'", message.capsuleName(), definition.name());
            }
            var core = new CapsuleCore(definition);
            var subscription = core.onStimulus(stimulus -> deliver(new ProtocolMessage.StimulusEvent(stimulus)));
            try {
                core.boot();
            } catch (RuntimeException ex) {
                subscription.run();
                LOGGER.error("Boot of capsule '{}' failed: {}", definition.name(), ex.getMessage());
                deliver(ProtocolMessage.BootResponse.failed(ex));
                return;
            }
            capsule = core;
            stimulusSubscription = subscription;
            state = CapsuleState.BOOTED;
            deliver(ProtocolMessage.BootResponse.ready(core.describe()));
        }
    }

    private void handleTrigger(ProtocolMessage.Trigger message) {
        var id = message.id();
        if (message.signalAborted()) {
            deliver(ProtocolMessage.Response.failed(
                id,
                new AbortException("Operation aborted before execution", CancellationToken.REASON_USER)
            ));
            return;
        }
        var token = new CancellationToken();
        if (inFlight.putIfAbsent(id, token) != null) {
            deliver(ProtocolMessage.Response.failed(id, new ProtocolException("Duplicate request id: " + id)));
            return;
        }
        try {
            workers.execute(() -> runTrigger(message, token));
        } catch (RejectedExecutionException ex) {
            inFlight.remove(id);
            deliver(ProtocolMessage.Response.failed(id, LifecycleException.of("trigger", CapsuleState.SHUTDOWN.wireName())));
        }
    }

    private void runTrigger(ProtocolMessage.Trigger message, CancellationToken token) {
        var id = message.id();
        try {
            var core = currentCapsule();
            if (core == null) {
                deliver(ProtocolMessage.Response.failed(id, LifecycleException.of("trigger", state.wireName())));
                return;
            }
            LOGGER.debug("Triggering {}.{} ({})", message.capability(), message.operation(), id);
            var result = core.trigger(message.capability(), message.operation(), message.params(), token);
            if (result instanceof CapsuleStream stream) {
                pump(id, stream, token);
            } else {
                deliver(ProtocolMessage.Response.success(id, result));
            }
        } catch (RuntimeException ex) {
            LOGGER.debug("Trigger {} failed: {}", id, ex.getMessage());
            deliver(ProtocolMessage.Response.failed(id, abortAware(ex, token)));
        } finally {
            inFlight.remove(id);
        }
    }

    private void pump(String id, CapsuleStream stream, CancellationToken token) {
        try (stream) {
            while (!token.isCancelled() && stream.hasNext()) {
                deliver(new ProtocolMessage.StreamData(id, stream.next()));
            }
            deliver(ProtocolMessage.StreamEnd.completed(id));
        } catch (RuntimeException ex) {
            LOGGER.debug("Stream {} failed: {}", id, ex.getMessage());
            deliver(ProtocolMessage.StreamEnd.failed(id, abortAware(ex, token)));
        }
    }

    private void handleAbort(ProtocolMessage.Abort message) {
        var token = inFlight.get(message.id());
        if (token == null) {
            LOGGER.debug("Abort for unknown request '{}'", message.id());
            return;
        }
        token.cancel(message.reason());
        LOGGER.debug("Aborted request '{}' ({})", message.id(), token.reason());
    }

    private void answerShutdown() {
        var response = shutdown();
        synchronized (outputLock) {
            shutdownAnswered = true;
            try {
                writer.send(response);
            } catch (TransportException ex) {
                LOGGER.warn("Could not write shutdown response: {}", ex.getMessage());
            }
        }
    }

    private CapsuleCore currentCapsule() {
        synchronized (stateLock) {
            return state == CapsuleState.BOOTED ? capsule : null;
        }
    }

    private Throwable abortAware(RuntimeException error, CancellationToken token) {
        if (error instanceof AbortException || !token.isCancelled()) {
            return error;
        }
        return new AbortException(
            "Operation aborted: " + CapsuleErrors.message(error) + " (" + token.reason() + ")",
            token.reason()
        );
    }

    // The shutdown response is the last trigger output; the check and the write share outputLock.
    private void deliver(ProtocolMessage message) {
        synchronized (outputLock) {
            if (shutdownAnswered && !(message instanceof ProtocolMessage.BootResponse)) {
                LOGGER.debug("Discarding late {} message for '{}'", message.type().wireName(), message.id());
                return;
            }
            try {
                writer.send(message);
            } catch (TransportException ex) {
                LOGGER.warn("Could not write {} message: {}", message.type().wireName(), ex.getMessage());
            }
        }
    }
}
