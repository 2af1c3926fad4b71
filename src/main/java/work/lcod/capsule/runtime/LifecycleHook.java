package work.lcod.capsule.runtime;

/**
 * Boot or shutdown hook of a capsule. Hooks may emit stimuli through the context but cannot trigger operations.
 */
@FunctionalInterface
public interface LifecycleHook {
    void run(LifecycleContext ctx) throws Exception;
}
