package work.lcod.capsule.stimulus;

@FunctionalInterface
public interface StimulusListener {
    void onStimulus(Stimulus stimulus);
}
