package work.lcod.capsule.transport;

/**
 * Starts the process hosting a protocol runner. The remote facade only needs its two byte streams and a way to
 * terminate it, so subprocesses, ssh sessions and in-process runners are interchangeable.
 */
@FunctionalInterface
public interface ProcessLauncher {
    /**
     * @throws work.lcod.capsule.error.TransportException when the process cannot be started
     */
    LaunchedProcess launch();
}
