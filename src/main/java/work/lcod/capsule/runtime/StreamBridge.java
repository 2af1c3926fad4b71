package work.lcod.capsule.runtime;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import work.lcod.capsule.error.AbortException;
import work.lcod.capsule.error.CapsuleException;

/**
 * Queue-backed {@link CapsuleStream}: producers push items, an error or the end marker from any thread; the
 * consumer drains queued entries in order and blocks only when the queue is empty.
 *
 * <p>Used by the remote facade to turn inbound {@code stream-data}/{@code stream-end} messages into a sequence, and
 * by stream handlers that produce their items on a background thread.</p>
 */
public final class StreamBridge implements CapsuleStream {
    private enum Kind {
        ITEM,
        ERROR,
        END
    }

    private record Entry(Kind kind, Object value, CapsuleException error) {}

    private static final Entry END = new Entry(Kind.END, null, null);

    private final BlockingQueue<Entry> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean producerTerminated = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final List<Runnable> finishHooks = new CopyOnWriteArrayList<>();
    private Entry lookahead;

    public void pushData(Object item) {
        if (!producerTerminated.get() && !finished.get()) {
            queue.add(new Entry(Kind.ITEM, item, null));
        }
    }

    public void pushError(CapsuleException error) {
        if (producerTerminated.compareAndSet(false, true)) {
            queue.add(new Entry(Kind.ERROR, null, error));
        }
    }

    public void pushEnd() {
        if (producerTerminated.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    /**
     * {@code true} once the consumer reached the end, hit an error or closed the stream. Producers should stop.
     */
    public boolean isFinished() {
        return finished.get();
    }

    /**
     * Registers a callback run once when the consumer side finishes, for any reason.
     */
    public void onFinish(Runnable hook) {
        finishHooks.add(hook);
        if (finished.get() && finishHooks.remove(hook)) {
            hook.run();
        }
    }

    @Override
    public synchronized boolean hasNext() {
        if (finished.get()) {
            return false;
        }
        if (lookahead != null) {
            return true;
        }
        Entry entry;
        try {
            entry = queue.take();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            finish();
            throw new AbortException("Interrupted while waiting for stream data", "interrupted");
        }
        return switch (entry.kind()) {
            case ITEM -> {
                lookahead = entry;
                yield true;
            }
            case ERROR -> {
                finish();
                throw entry.error();
            }
            case END -> {
                finish();
                yield false;
            }
        };
    }

    @Override
    public synchronized Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream has ended");
        }
        var value = lookahead.value();
        lookahead = null;
        return value;
    }

    @Override
    public void close() {
        queue.clear();
        finish();
        // wakes a consumer blocked in hasNext()
        queue.add(END);
    }

    private void finish() {
        if (finished.compareAndSet(false, true)) {
            for (var hook : finishHooks) {
                if (finishHooks.remove(hook)) {
                    hook.run();
                }
            }
        }
    }
}
