package work.lcod.capsule.api;

import java.util.List;
import java.util.Optional;

/**
 * Static description of a capsule returned by {@link Capsule#describe()} and carried by the boot response.
 *
 * @param id stable for the lifetime of one capsule instance
 */
public record CapsuleMetadata(
    String id,
    String name,
    String docs,
    List<CapabilityInfo> capabilities,
    List<SenseInfo> senses
) {
    public CapsuleMetadata {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        senses = senses == null ? List.of() : List.copyOf(senses);
    }

    public Optional<OperationInfo> findOperation(String capability, String operation) {
        return capabilities.stream()
            .filter(cap -> cap.name().equals(capability))
            .flatMap(cap -> cap.operations().stream())
            .filter(op -> op.name().equals(operation))
            .findFirst();
    }

    public boolean hasCapability(String capability) {
        return capabilities.stream().anyMatch(cap -> cap.name().equals(capability));
    }

    public record CapabilityInfo(String name, String docs, List<OperationInfo> operations) {
        public CapabilityInfo {
            operations = operations == null ? List.of() : List.copyOf(operations);
        }
    }

    /**
     * @param kind {@code "call"} or {@code "stream"}
     */
    public record OperationInfo(String name, String docs, String signature, String kind) {}

    public record SenseInfo(String name, String docs, String signature) {}
}
