package work.lcod.capsule.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.Pipe;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.error.TransportException;
import work.lcod.capsule.protocol.MessageCodec;
import work.lcod.capsule.protocol.MessageWriter;
import work.lcod.capsule.protocol.ProtocolRunner;
import work.lcod.capsule.runtime.CapsuleDefinition;

/**
 * Runs a protocol runner on a thread of the current JVM, connected to the facade through in-memory pipes. The
 * messages still go through the codec and the line framing, so everything but process spawning is exercised.
 */
public final class LoopbackLauncher implements ProcessLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoopbackLauncher.class);
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final CapsuleDefinition definition;
    private final Duration drainTimeout;

    public LoopbackLauncher(CapsuleDefinition definition) {
        this(definition, Duration.ofSeconds(1));
    }

    public LoopbackLauncher(CapsuleDefinition definition, Duration drainTimeout) {
        this.definition = definition;
        this.drainTimeout = drainTimeout;
    }

    @Override
    public LaunchedProcess launch() {
        Pipe toRunner;
        Pipe toFacade;
        try {
            toRunner = Pipe.open();
            toFacade = Pipe.open();
        } catch (IOException ex) {
            throw new TransportException("Failed to open loopback pipes: " + ex.getMessage(), ex);
        }
        var codec = new MessageCodec();
        var runnerInput = Channels.newInputStream(toRunner.source());
        var runnerOutput = new MessageWriter(Channels.newOutputStream(toFacade.sink()), codec);
        var runner = new ProtocolRunner(definition, runnerOutput, drainTimeout);
        var thread = new Thread(() -> {
            try {
                runner.serve(runnerInput, codec);
            } finally {
                runnerOutput.close();
            }
        }, "capsule-loopback-" + THREADS.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
        LOGGER.debug("Started loopback runner for capsule '{}'", definition.name());
        return new Loopback(Channels.newInputStream(toFacade.source()), Channels.newOutputStream(toRunner.sink()));
    }

    private static final class Loopback implements LaunchedProcess {
        private final InputStream input;
        private final OutputStream output;
        private final AtomicBoolean terminated = new AtomicBoolean(false);

        private Loopback(InputStream input, OutputStream output) {
            this.input = input;
            this.output = output;
        }

        @Override
        public InputStream input() {
            return input;
        }

        @Override
        public OutputStream output() {
            return output;
        }

        @Override
        public void terminate() {
            if (!terminated.compareAndSet(false, true)) {
                return;
            }
            closeQuietly(output);
            closeQuietly(input);
        }

        private static void closeQuietly(AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception ex) {
                LOGGER.debug("Closing loopback stream failed: {}", ex.getMessage());
            }
        }
    }
}
