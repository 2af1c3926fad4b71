package work.lcod.capsule.remote;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.api.Capsule;
import work.lcod.capsule.api.CapsuleConfig;
import work.lcod.capsule.api.CapsuleMetadata;
import work.lcod.capsule.api.CapsuleState;
import work.lcod.capsule.error.AbortException;
import work.lcod.capsule.error.CapsuleException;
import work.lcod.capsule.error.LifecycleException;
import work.lcod.capsule.error.ProtocolException;
import work.lcod.capsule.error.TransportException;
import work.lcod.capsule.error.ValidationException;
import work.lcod.capsule.protocol.MessageCodec;
import work.lcod.capsule.protocol.MessageReader;
import work.lcod.capsule.protocol.MessageWriter;
import work.lcod.capsule.protocol.ProtocolMessage;
import work.lcod.capsule.runtime.CancellationToken;
import work.lcod.capsule.runtime.StreamBridge;
import work.lcod.capsule.stimulus.Stimulus;
import work.lcod.capsule.stimulus.StimulusBus;
import work.lcod.capsule.stimulus.StimulusListener;
import work.lcod.capsule.transport.LaunchedProcess;
import work.lcod.capsule.transport.ProcessLauncher;

/**
 * {@link Capsule} whose engine lives in another process. Boot launches that process and performs the boot
 * handshake; triggers are sent as messages and their answers routed back by id; stimuli received from the runner are
 * delivered to local listeners.
 *
 * <p>A transport failure fails every outstanding request and open stream with a
 * {@link TransportException}; the facade cannot be used afterwards except to shut it down.</p>
 */
public final class RemoteCapsule implements Capsule {
    static final String BOOT_ID = "boot";
    static final String SHUTDOWN_ID = "shutdown";

    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteCapsule.class);
    private static final Runnable NO_OP = () -> {};

    private final ProcessLauncher launcher;
    private final String capsuleName;
    private final CapsuleConfig config;
    private final MessageCodec codec = new MessageCodec();
    private final PendingRequests pending = new PendingRequests();
    private final Map<String, StreamBridge> streams = new ConcurrentHashMap<>();
    private final StimulusBus bus = new StimulusBus();
    private final AtomicLong requestCounter = new AtomicLong();
    private final Object lifecycleLock = new Object();
    private volatile CapsuleState state = CapsuleState.CREATED;
    private volatile CapsuleMetadata metadata;
    private volatile Connection connection;
    private volatile TransportException broken;

    public RemoteCapsule(ProcessLauncher launcher, String capsuleName) {
        this(launcher, capsuleName, CapsuleConfig.defaults());
    }

    public RemoteCapsule(ProcessLauncher launcher, String capsuleName, CapsuleConfig config) {
        this.launcher = launcher;
        this.capsuleName = capsuleName;
        this.config = config;
    }

    /**
     * Metadata received with the boot response.
     *
     * @throws LifecycleException before the first successful boot
     */
    @Override
    public CapsuleMetadata describe() {
        var current = metadata;
        if (current == null) {
            throw LifecycleException.of("describe", state.wireName());
        }
        return current;
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
                    var conn = connect();
                    var future = pending.register(BOOT_ID);
                    try {
                        conn.send(new ProtocolMessage.Boot(capsuleName));
                        var response = expect(await(future, config.bootTimeout(), "boot"), ProtocolMessage.BootResponse.class);
                        if (!response.ready()) {
                            throw response.failure();
                        }
                        metadata = response.metadata();
                        state = CapsuleState.BOOTED;
                    } catch (RuntimeException ex) {
                        pending.discard(BOOT_ID);
                        teardown(conn);
                        throw ex;
                    }
                }
            }
        }
        LOGGER.debug("Remote capsule '{}' booted", capsuleName);
    }

    /**
     * Asks the runner to shut down and waits up to the shutdown timeout for its answer. The connection is closed and
     * the state moves to {@code shutdown} in every case; a runner-reported failure is rethrown afterwards.
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
                    var conn = connection;
                    CapsuleException failure = null;
                    if (conn != null && broken == null) {
                        var future = pending.register(SHUTDOWN_ID);
                        try {
                            conn.send(new ProtocolMessage.Shutdown());
                            var response = expect(
                                await(future, config.shutdownTimeout(), "shutdown"),
                                ProtocolMessage.ShutdownResponse.class
                            );
                            if (!response.ok()) {
                                failure = response.failure();
                            }
                        } catch (TransportException | ProtocolException ex) {
                            LOGGER.warn("Shutdown of remote capsule '{}' did not complete: {}", capsuleName, ex.getMessage());
                        } finally {
                            pending.discard(SHUTDOWN_ID);
                        }
                    }
                    teardown(conn);
                    state = CapsuleState.SHUTDOWN;
                    if (failure != null) {
                        throw failure;
                    }
                }
            }
        }
        LOGGER.debug("Remote capsule '{}' shut down", capsuleName);
    }

    @Override
    public Object trigger(String capability, String operation, Object params, CancellationToken token) {
        var current = state;
        if (current != CapsuleState.BOOTED) {
            throw LifecycleException.of("trigger", current.wireName());
        }
        var failure = broken;
        if (failure != null) {
            throw new TransportException(failure.getMessage(), failure);
        }
        var conn = connection;
        if (conn == null) {
            throw new TransportException("Remote capsule '" + capsuleName + "' is not connected");
        }
        var info = metadata.findOperation(capability, operation).orElseThrow(() -> metadata.hasCapability(capability)
            ? ValidationException.unknownOperation(capability, operation)
            : ValidationException.unknownCapability(capability));
        if (token != null && token.isCancelled()) {
            throw new AbortException("Operation aborted before execution", token.reason());
        }

        var id = "trigger-" + requestCounter.incrementAndGet();
        return "stream".equals(info.kind())
            ? openStream(conn, id, capability, operation, params, token)
            : call(conn, id, capability, operation, params, token);
    }

    /**
     * Delivers the stimulus to this facade's local listeners only; nothing is sent to the remote capsule.
     */
    @Override
    public void emit(Stimulus stimulus) {
        if (state != CapsuleState.BOOTED) {
            return;
        }
        bus.publish(stimulus.stamped());
    }

    @Override
    public Runnable onStimulus(StimulusListener listener) {
        return bus.subscribe(listener);
    }

    int pendingCount() {
        return pending.size() + streams.size();
    }

    private Object call(
        Connection conn,
        String id,
        String capability,
        String operation,
        Object params,
        CancellationToken token
    ) {
        var future = pending.register(id);
        var abortSent = new AtomicBoolean(false);
        var unlisten = token == null ? NO_OP : token.onCancel(reason -> sendAbort(conn, id, reason, abortSent));
        try {
            conn.send(new ProtocolMessage.Trigger(id, capability, operation, params, token != null && token.isCancelled()));
            ProtocolMessage message;
            try {
                message = await(future, null, capability + "." + operation);
            } catch (AbortException ex) {
                sendAbort(conn, id, ex.reason(), abortSent);
                throw ex;
            }
            var response = expect(message, ProtocolMessage.Response.class);
            if (!response.successful()) {
                throw response.failure();
            }
            return response.result();
        } finally {
            unlisten.run();
            pending.discard(id);
        }
    }

    private StreamBridge openStream(
        Connection conn,
        String id,
        String capability,
        String operation,
        Object params,
        CancellationToken token
    ) {
        var bridge = new StreamBridge();
        streams.put(id, bridge);
        var abortSent = new AtomicBoolean(false);
        var unlisten = token == null ? NO_OP : token.onCancel(reason -> {
            sendAbort(conn, id, reason, abortSent);
            bridge.close();
        });
        bridge.onFinish(() -> {
            unlisten.run();
            // still registered: the consumer stopped before the runner ended the stream
            if (streams.remove(id) != null) {
                sendAbort(conn, id, CancellationToken.REASON_USER, abortSent);
            }
        });
        try {
            conn.send(new ProtocolMessage.Trigger(id, capability, operation, params, token != null && token.isCancelled()));
        } catch (RuntimeException ex) {
            streams.remove(id);
            bridge.close();
            throw ex;
        }
        return bridge;
    }

    private void sendAbort(Connection conn, String id, String reason, AtomicBoolean sent) {
        if (!sent.compareAndSet(false, true) || conn.closing.get()) {
            return;
        }
        try {
            conn.send(new ProtocolMessage.Abort(id, reason));
        } catch (RuntimeException ex) {
            LOGGER.debug("Could not send abort for {}: {}", id, ex.getMessage());
        }
    }

    private void route(ProtocolMessage message) {
        if (message instanceof ProtocolMessage.BootResponse) {
            resolveFixed(BOOT_ID, message);
        } else if (message instanceof ProtocolMessage.ShutdownResponse) {
            resolveFixed(SHUTDOWN_ID, message);
        } else if (message instanceof ProtocolMessage.Response response) {
            if (pending.resolve(response.id(), response)) {
                return;
            }
            var bridge = streams.remove(response.id());
            if (bridge != null) {
                bridge.pushError(response.successful()
                    ? new ProtocolException("Unexpected response for stream " + response.id(), response.id(), null)
                    : response.failure());
            } else {
                LOGGER.warn("Dropping response for unknown request '{}'", response.id());
            }
        } else if (message instanceof ProtocolMessage.StreamData data) {
            var bridge = streams.get(data.id());
            if (bridge != null) {
                bridge.pushData(data.data());
            } else {
                LOGGER.debug("Dropping stream data for unknown request '{}'", data.id());
            }
        } else if (message instanceof ProtocolMessage.StreamEnd end) {
            var bridge = streams.remove(end.id());
            if (bridge == null) {
                LOGGER.debug("Dropping stream end for unknown request '{}'", end.id());
            } else if (end.error() != null) {
                bridge.pushError(end.failure());
            } else {
                bridge.pushEnd();
            }
        } else if (message instanceof ProtocolMessage.StimulusEvent event) {
            bus.publish(event.stimulus());
        } else {
            LOGGER.warn("Ignoring unexpected {} message from remote capsule '{}'", message.type().wireName(), capsuleName);
        }
    }

    private void resolveFixed(String id, ProtocolMessage message) {
        if (!pending.resolve(id, message)) {
            LOGGER.warn("Dropping unsolicited {} message from remote capsule '{}'", message.type().wireName(), capsuleName);
        }
    }

    private Connection connect() {
        LaunchedProcess process = launcher.launch();
        var conn = new Connection(process, new MessageWriter(process.output(), codec));
        var reader = new MessageReader(process.input(), codec, new MessageReader.Listener() {
            @Override
            public void onMessage(ProtocolMessage message) {
                route(message);
            }

            @Override
            public void onClosed(IOException error) {
                disconnected(conn, error);
            }
        });
        connection = conn;
        broken = null;
        reader.start("capsule-remote-" + capsuleName);
        return conn;
    }

    private void disconnected(Connection conn, IOException error) {
        if (conn.closing.get()) {
            failOutstanding(shutDownFailure());
            return;
        }
        var failure = error == null
            ? new TransportException("Remote capsule '" + capsuleName + "' closed the connection")
            : new TransportException("Remote capsule '" + capsuleName + "' transport failed: " + error.getMessage(), error);
        if (connection == conn) {
            broken = failure;
        }
        LOGGER.warn(failure.getMessage());
        failOutstanding(failure);
    }

    private void teardown(Connection conn) {
        if (conn == null) {
            return;
        }
        conn.closing.set(true);
        conn.writer.close();
        conn.process.terminate();
        if (connection == conn) {
            connection = null;
        }
        failOutstanding(shutDownFailure());
    }

    private void failOutstanding(CapsuleException failure) {
        pending.failAll(failure);
        for (var id : new ArrayList<>(streams.keySet())) {
            var bridge = streams.remove(id);
            if (bridge != null) {
                bridge.pushError(failure);
            }
        }
    }

    private static AbortException shutDownFailure() {
        return new AbortException(
            "Operation aborted: capsule shut down (" + CancellationToken.REASON_SYSTEM + ")",
            CancellationToken.REASON_SYSTEM
        );
    }

    private static ProtocolMessage await(CompletableFuture<ProtocolMessage> future, Duration timeout, String what) {
        try {
            return timeout == null ? future.get() : future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new TransportException("Timed out waiting for " + what + " response after " + timeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            var cause = ex.getCause();
            if (cause instanceof CapsuleException ce) {
                throw ce;
            }
            throw new TransportException("Waiting for " + what + " response failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AbortException("Interrupted while waiting for " + what + " response", "interrupted");
        }
    }

    private static <T extends ProtocolMessage> T expect(ProtocolMessage message, Class<T> type) {
        if (!type.isInstance(message)) {
            throw new ProtocolException("Expected " + type.getSimpleName() + " but received " + message.type().wireName());
        }
        return type.cast(message);
    }

    private static final class Connection {
        private final LaunchedProcess process;
        private final MessageWriter writer;
        private final AtomicBoolean closing = new AtomicBoolean(false);

        private Connection(LaunchedProcess process, MessageWriter writer) {
            this.process = process;
            this.writer = writer;
        }

        void send(ProtocolMessage message) {
            if (!writer.send(message)) {
                throw new TransportException("Remote capsule connection is closed");
            }
        }
    }
}
