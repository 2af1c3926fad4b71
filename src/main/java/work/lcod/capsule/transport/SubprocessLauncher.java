package work.lcod.capsule.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.error.TransportException;

/**
 * Spawns a local command whose stdin/stdout carry the protocol. The child's stderr is inherited so its diagnostics
 * end up next to the caller's.
 */
public final class SubprocessLauncher implements ProcessLauncher {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubprocessLauncher.class);
    private static final long TERMINATE_GRACE_MS = 1000;

    private final List<String> command;
    private final Path workingDirectory;
    private final Map<String, String> environment;

    public SubprocessLauncher(List<String> command) {
        this(command, null, Map.of());
    }

    public SubprocessLauncher(List<String> command, Path workingDirectory, Map<String, String> environment) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Subprocess command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.environment = environment == null ? Map.of() : new LinkedHashMap<>(environment);
    }

    public List<String> command() {
        return command;
    }

    @Override
    public LaunchedProcess launch() {
        var builder = new ProcessBuilder(new ArrayList<>(command));
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().putAll(environment);
        builder.redirectError(ProcessBuilder.Redirect.INHERIT);
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new TransportException("Failed to start " + command.get(0) + ": " + ex.getMessage(), ex);
        }
        LOGGER.debug("Started capsule process {} ({})", process.pid(), String.join(" ", command));
        return new Subprocess(process);
    }

    private static final class Subprocess implements LaunchedProcess {
        private final Process process;
        private final AtomicBoolean terminated = new AtomicBoolean(false);

        private Subprocess(Process process) {
            this.process = process;
        }

        @Override
        public InputStream input() {
            return process.getInputStream();
        }

        @Override
        public OutputStream output() {
            return process.getOutputStream();
        }

        @Override
        public void terminate() {
            if (!terminated.compareAndSet(false, true)) {
                return;
            }
            try {
                process.getOutputStream().close();
            } catch (IOException ex) {
                LOGGER.debug("Closing stdin of process {} failed: {}", process.pid(), ex.getMessage());
            }
            process.destroy();
            try {
                if (!process.waitFor(TERMINATE_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
            LOGGER.debug("Capsule process {} terminated", process.pid());
        }
    }
}
