package work.lcod.capsule.api;

import work.lcod.capsule.runtime.CapsuleDefinition;

/**
 * Service-loaded source of capsule definitions. The CLI looks providers up by {@link #name()} when asked to serve
 * a capsule; implementations are listed in {@code META-INF/services/work.lcod.capsule.api.CapsuleProvider}.
 */
public interface CapsuleProvider {
    String name();

    /**
     * Returns a fresh definition. Called once per served capsule.
     */
    CapsuleDefinition definition();
}
