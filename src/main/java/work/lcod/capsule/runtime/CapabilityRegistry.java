package work.lcod.capsule.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.capsule.api.CapsuleMetadata;
import work.lcod.capsule.error.ValidationException;

/**
 * Read-only lookup of capability name, then operation name, to operation definition.
 */
final class CapabilityRegistry {
    private final Map<String, Capability> capabilities;

    CapabilityRegistry(List<Capability> definitions) {
        var byName = new LinkedHashMap<String, Capability>();
        for (var capability : definitions) {
            byName.put(capability.name(), capability);
        }
        this.capabilities = Collections.unmodifiableMap(byName);
    }

    Operation resolve(String capability, String operation) {
        var entry = capability == null ? null : capabilities.get(capability);
        if (entry == null) {
            throw ValidationException.unknownCapability(capability);
        }
        var op = operation == null ? null : entry.operations().get(operation);
        if (op == null) {
            throw ValidationException.unknownOperation(capability, operation);
        }
        return op;
    }

    List<CapsuleMetadata.CapabilityInfo> describe() {
        var result = new ArrayList<CapsuleMetadata.CapabilityInfo>(capabilities.size());
        for (var capability : capabilities.values()) {
            var operations = new ArrayList<CapsuleMetadata.OperationInfo>();
            for (var op : capability.operations().values()) {
                operations.add(new CapsuleMetadata.OperationInfo(op.name(), op.docs(), op.signature(), op.kind().wireName()));
            }
            result.add(new CapsuleMetadata.CapabilityInfo(capability.name(), capability.docs(), operations));
        }
        return result;
    }
}
