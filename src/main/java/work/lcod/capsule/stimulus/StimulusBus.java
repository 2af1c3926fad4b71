package work.lcod.capsule.stimulus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous in-process fan-out of stimuli. Listeners are called in registration order on the publishing thread;
 * a failing listener is logged and does not prevent delivery to the others.
 */
public final class StimulusBus {
    private static final Logger LOGGER = LoggerFactory.getLogger(StimulusBus.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * @return a handle removing exactly this registration, even when the same listener was added twice
     */
    public Runnable subscribe(StimulusListener listener) {
        var registration = new Registration(listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    public void publish(Stimulus stimulus) {
        for (var registration : registrations) {
            try {
                registration.listener.onStimulus(stimulus);
            } catch (RuntimeException ex) {
                LOGGER.warn("Stimulus listener failed for sense '{}': {}", stimulus.sense(), ex.getMessage(), ex);
            }
        }
    }

    public int listenerCount() {
        return registrations.size();
    }

    // identity-based so that removing one registration never removes a twin
    private static final class Registration {
        private final StimulusListener listener;

        private Registration(StimulusListener listener) {
            this.listener = listener;
        }
    }
}
