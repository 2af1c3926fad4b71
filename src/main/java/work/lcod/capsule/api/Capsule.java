package work.lcod.capsule.api;

import work.lcod.capsule.error.ValidationException;
import work.lcod.capsule.runtime.CancellationToken;
import work.lcod.capsule.runtime.CapsuleStream;
import work.lcod.capsule.stimulus.Stimulus;
import work.lcod.capsule.stimulus.StimulusListener;

/**
 * Caller-facing contract shared by the in-process engine and the remote facade. Callers cannot tell which one they
 * hold: both enforce the same lifecycle, raise the same exceptions and deliver stimuli the same way.
 */
public interface Capsule {
    /**
     * Static metadata. The local engine answers in any state; a remote facade only knows it once booted.
     */
    CapsuleMetadata describe();

    /**
     * Idempotent once booted; fails with {@link work.lcod.capsule.error.LifecycleException} after shutdown.
     */
    void boot();

    /**
     * Idempotent once shut down; fails with {@link work.lcod.capsule.error.LifecycleException} when never booted.
     */
    void shutdown();

    CapsuleState state();

    default Object trigger(String capability, String operation, Object params) {
        return trigger(capability, operation, params, null);
    }

    /**
     * Invokes an operation. Call operations return their single result; stream operations return a
     * {@link CapsuleStream} without waiting for the first item.
     *
     * @param token optional caller token; cancelling it aborts the invocation cooperatively
     */
    Object trigger(String capability, String operation, Object params, CancellationToken token);

    /**
     * Same as {@link #trigger(String, String, Object, CancellationToken)} for operations known to stream.
     */
    default CapsuleStream stream(String capability, String operation, Object params, CancellationToken token) {
        var result = trigger(capability, operation, params, token);
        if (result instanceof CapsuleStream stream) {
            return stream;
        }
        throw new ValidationException(capability + "." + operation + " is not a stream operation");
    }

    void emit(Stimulus stimulus);

    /**
     * @return a handle removing exactly this registration
     */
    Runnable onStimulus(StimulusListener listener);
}
