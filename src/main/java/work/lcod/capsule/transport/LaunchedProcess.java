package work.lcod.capsule.transport;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * A running protocol runner as seen from the facade.
 */
public interface LaunchedProcess {
    /**
     * Protocol lines written by the runner.
     */
    InputStream input();

    /**
     * Protocol lines read by the runner.
     */
    OutputStream output();

    /**
     * Releases the process and its streams. Safe to call more than once.
     */
    void terminate();
}
