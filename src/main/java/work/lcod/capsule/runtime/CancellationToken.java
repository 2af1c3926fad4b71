package work.lcod.capsule.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.error.AbortException;

/**
 * Cooperative cancellation signal: a flag, the reason it was raised and the listeners to notify.
 * Cancelling never interrupts a thread; handlers are expected to poll {@link #isCancelled()} or register
 * {@link #onCancel(Consumer)}.
 */
public final class CancellationToken {
    public static final String REASON_USER = "user";
    public static final String REASON_SYSTEM = "system";

    private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);
    private static final Runnable NO_OP = () -> {};

    private final Object lock = new Object();
    private final List<Consumer<String>> listeners = new ArrayList<>();
    private volatile boolean cancelled = false;
    private volatile String reason;

    public static CancellationToken cancelled(String reason) {
        var token = new CancellationToken();
        token.cancel(reason);
        return token;
    }

    public boolean cancel() {
        return cancel(REASON_USER);
    }

    /**
     * Raises the flag and fires every registered listener once. Later calls are ignored.
     *
     * @return {@code true} when this call performed the cancellation
     */
    public boolean cancel(String reason) {
        List<Consumer<String>> toNotify;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            this.reason = reason == null || reason.isBlank() ? REASON_USER : reason;
            this.cancelled = true;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (var listener : toNotify) {
            notifyListener(listener);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }

    /**
     * Registers a listener receiving the cancellation reason. When the token is already cancelled the listener runs
     * immediately on the calling thread.
     *
     * @return a handle removing exactly this registration
     */
    public Runnable onCancel(Consumer<String> listener) {
        synchronized (lock) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        notifyListener(listener);
        return NO_OP;
    }

    /**
     * Makes this token follow {@code parent}: cancelling the parent cancels this token with the parent's reason.
     *
     * @return a handle detaching this token from the parent
     */
    public Runnable link(CancellationToken parent) {
        if (parent == null || parent == this) {
            return NO_OP;
        }
        return parent.onCancel(this::cancel);
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new AbortException("Operation aborted (" + reason + ")", reason);
        }
    }

    private void notifyListener(Consumer<String> listener) {
        try {
            listener.accept(reason);
        } catch (RuntimeException ex) {
            LOGGER.warn("Cancellation listener failed: {}", ex.getMessage(), ex);
        }
    }
}
