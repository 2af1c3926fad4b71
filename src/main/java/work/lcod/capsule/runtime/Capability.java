package work.lcod.capsule.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named group of operations. Operation order is preserved for introspection.
 */
public record Capability(String name, String docs, Map<String, Operation> operations) {
    public Capability {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
        operations = operations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    public static Capability of(String name, Operation... operations) {
        var byName = new LinkedHashMap<String, Operation>();
        for (var operation : operations) {
            if (byName.putIfAbsent(operation.name(), operation) != null) {
                throw new IllegalArgumentException("Duplicate operation '" + operation.name() + "' in capability " + name);
            }
        }
        return new Capability(name, null, byName);
    }

    public Capability withDocs(String newDocs) {
        return new Capability(name, newDocs, operations);
    }
}
