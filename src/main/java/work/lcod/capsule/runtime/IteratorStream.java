package work.lcod.capsule.runtime;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.capsule.error.CapsuleErrors;

/**
 * Adapts a handler-produced iterator to {@link CapsuleStream}. Items pass through untouched; failures are normalized
 * to capsule exceptions and the finish callback runs once, whichever way the sequence ends.
 */
final class IteratorStream implements CapsuleStream {
    private static final Logger LOGGER = LoggerFactory.getLogger(IteratorStream.class);

    private final Iterator<?> delegate;
    private final Runnable onFinish;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    IteratorStream(Iterator<?> delegate, Runnable onFinish) {
        this.delegate = delegate;
        this.onFinish = onFinish;
    }

    @Override
    public boolean hasNext() {
        if (finished.get()) {
            return false;
        }
        boolean more;
        try {
            more = delegate.hasNext();
        } catch (RuntimeException ex) {
            finish();
            throw CapsuleErrors.normalize(ex);
        }
        if (!more) {
            finish();
        }
        return more;
    }

    @Override
    public Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream has ended");
        }
        try {
            return delegate.next();
        } catch (RuntimeException ex) {
            finish();
            throw CapsuleErrors.normalize(ex);
        }
    }

    @Override
    public void close() {
        if (delegate instanceof AutoCloseable closeable && !finished.get()) {
            try {
                closeable.close();
            } catch (Exception ex) {
                LOGGER.debug("Closing stream source failed: {}", ex.getMessage());
            }
        }
        finish();
    }

    private void finish() {
        if (finished.compareAndSet(false, true) && onFinish != null) {
            onFinish.run();
        }
    }
}
