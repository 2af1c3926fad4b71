package work.lcod.capsule.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import work.lcod.capsule.stimulus.Stimulus;
import work.lcod.capsule.stimulus.StimulusSource;

/**
 * Execution context passed to operation handlers: the params that survived the middleware chain, the cancellation
 * token and an emit bound to this operation as stimulus source.
 */
public final class OperationContext {
    private final String capability;
    private final String operation;
    private final Object params;
    private final CancellationToken token;
    private final Consumer<Stimulus> emitter;

    OperationContext(String capability, String operation, Object params, CancellationToken token, Consumer<Stimulus> emitter) {
        this.capability = capability;
        this.operation = operation;
        this.params = params;
        this.token = token;
        this.emitter = emitter;
    }

    public String capability() {
        return capability;
    }

    public String operation() {
        return operation;
    }

    public Object params() {
        return params;
    }

    /**
     * Params as a map; non-map params yield an empty map.
     */
    public Map<String, Object> paramsAsMap() {
        if (params instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return copy;
        }
        return Map.of();
    }

    public Object param(String key) {
        return params instanceof Map<?, ?> map ? map.get(key) : null;
    }

    public CancellationToken token() {
        return token;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public void emit(String sense, Object data) {
        emit(Stimulus.of(sense, data));
    }

    public void emit(Stimulus stimulus) {
        emitter.accept(stimulus.withSource(new StimulusSource(capability, operation)));
    }
}
