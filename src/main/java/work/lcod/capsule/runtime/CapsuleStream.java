package work.lcod.capsule.runtime;

import java.util.Iterator;

/**
 * Lazy, non-restartable result of a stream operation. {@link #hasNext()} may block until the producer delivers the
 * next item or terminates; a producer failure surfaces as a {@link work.lcod.capsule.error.CapsuleException} thrown
 * from {@link #hasNext()}. Once the sequence ended or failed it stays terminated.
 */
public interface CapsuleStream extends Iterator<Object>, AutoCloseable {
    /**
     * Stops consuming. Items still buffered are discarded.
     */
    @Override
    void close();

    static CapsuleStream of(Iterator<?> iterator) {
        return new IteratorStream(iterator, null);
    }

    static CapsuleStream of(Iterable<?> iterable) {
        return new IteratorStream(iterable.iterator(), null);
    }
}
