package work.lcod.capsule.stimulus;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StimulusBusTest {
    @Test
    void deliversToListenersInRegistrationOrder() {
        var bus = new StimulusBus();
        var seen = new ArrayList<String>();
        bus.subscribe(s -> seen.add("first:" + s.sense()));
        bus.subscribe(s -> seen.add("second:" + s.sense()));

        bus.publish(Stimulus.of("ping", null));

        assertEquals(List.of("first:ping", "second:ping"), seen);
    }

    @Test
    void failingListenerDoesNotStopDelivery() {
        var bus = new StimulusBus();
        var seen = new ArrayList<Object>();
        bus.subscribe(s -> {
            throw new IllegalStateException("listener broke");
        });
        bus.subscribe(s -> seen.add(s.data()));

        bus.publish(Stimulus.of("ping", 7));

        assertEquals(List.of(7), seen);
    }

    @Test
    void unsubscribeRemovesOnlyThatRegistration() {
        var bus = new StimulusBus();
        var seen = new ArrayList<String>();
        StimulusListener listener = s -> seen.add(s.sense());
        var first = bus.subscribe(listener);
        bus.subscribe(listener);

        first.run();
        first.run();
        bus.publish(Stimulus.of("once", null));

        assertEquals(List.of("once"), seen);
        assertEquals(1, bus.listenerCount());
    }
}
