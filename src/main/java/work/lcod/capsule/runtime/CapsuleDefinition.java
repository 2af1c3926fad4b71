package work.lcod.capsule.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a capsule: its capabilities, capsule-level middleware, declared senses and lifecycle
 * hooks. The same definition can back a local engine or be served by a protocol runner in another process.
 */
public record CapsuleDefinition(
    String name,
    String docs,
    List<Middleware> middleware,
    List<Capability> capabilities,
    List<SenseDefinition> senses,
    LifecycleHook bootHook,
    LifecycleHook shutdownHook
) {
    public CapsuleDefinition {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Capsule name must not be blank");
        }
        middleware = middleware == null ? List.of() : List.copyOf(middleware);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        senses = senses == null ? List.of() : List.copyOf(senses);
        var seen = new HashSet<String>();
        for (var capability : capabilities) {
            if (!seen.add(capability.name())) {
                throw new IllegalArgumentException("Duplicate capability '" + capability.name() + "' in capsule " + name);
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String docs;
        private final List<Middleware> middleware = new ArrayList<>();
        private final List<Capability> capabilities = new ArrayList<>();
        private final List<SenseDefinition> senses = new ArrayList<>();
        private LifecycleHook bootHook;
        private LifecycleHook shutdownHook;

        private Builder(String name) {
            this.name = name;
        }

        public Builder docs(String docs) {
            this.docs = docs;
            return this;
        }

        public Builder middleware(Middleware middleware) {
            this.middleware.add(Objects.requireNonNull(middleware, "middleware"));
            return this;
        }

        public Builder capability(Capability capability) {
            this.capabilities.add(Objects.requireNonNull(capability, "capability"));
            return this;
        }

        public Builder sense(String senseName, String senseDocs, String signature) {
            this.senses.add(new SenseDefinition(senseName, senseDocs, signature));
            return this;
        }

        public Builder onBoot(LifecycleHook hook) {
            this.bootHook = hook;
            return this;
        }

        public Builder onShutdown(LifecycleHook hook) {
            this.shutdownHook = hook;
            return this;
        }

        public CapsuleDefinition build() {
            return new CapsuleDefinition(name, docs, middleware, capabilities, senses, bootHook, shutdownHook);
        }
    }
}
