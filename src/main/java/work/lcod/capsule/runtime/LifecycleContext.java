package work.lcod.capsule.runtime;

import java.util.function.Consumer;
import work.lcod.capsule.stimulus.Stimulus;

/**
 * Context handed to lifecycle hooks. Its emit bypasses the lifecycle check but only while the hook is running;
 * afterwards it silently drops.
 */
public final class LifecycleContext {
    private final Consumer<Stimulus> sink;
    private volatile boolean open = true;

    LifecycleContext(Consumer<Stimulus> sink) {
        this.sink = sink;
    }

    public void emit(String sense, Object data) {
        emit(Stimulus.of(sense, data));
    }

    public void emit(Stimulus stimulus) {
        if (open) {
            sink.accept(stimulus.withSource(null).stamped());
        }
    }

    void close() {
        open = false;
    }
}
