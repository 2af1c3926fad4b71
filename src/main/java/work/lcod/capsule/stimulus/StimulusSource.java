package work.lcod.capsule.stimulus;

/**
 * Provenance of a stimulus emitted from an operation handler.
 */
public record StimulusSource(String capability, String operation) {}
