package work.lcod.capsule.stimulus;

import java.util.Objects;

/**
 * An event emitted by a capsule independently of any trigger response.
 *
 * @param sense     tag such as {@code "tmux:output"} or {@code "fs:change"}
 * @param data      opaque payload
 * @param source    capability/operation that emitted it, {@code null} for lifecycle hooks
 * @param timestamp epoch milliseconds, stamped by the engine when absent
 */
public record Stimulus(String sense, Object data, StimulusSource source, Long timestamp) {
    public Stimulus {
        Objects.requireNonNull(sense, "sense");
    }

    public static Stimulus of(String sense, Object data) {
        return new Stimulus(sense, data, null, null);
    }

    public Stimulus withSource(StimulusSource newSource) {
        return new Stimulus(sense, data, newSource, timestamp);
    }

    public Stimulus stamped() {
        return timestamp != null ? this : new Stimulus(sense, data, source, System.currentTimeMillis());
    }
}
