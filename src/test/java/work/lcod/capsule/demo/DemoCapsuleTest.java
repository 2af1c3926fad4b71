package work.lcod.capsule.demo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.capsule.api.CapsuleState;
import work.lcod.capsule.error.HandlerException;
import work.lcod.capsule.error.MiddlewareRejectedException;
import work.lcod.capsule.runtime.CapsuleCore;
import work.lcod.capsule.stimulus.Stimulus;
import work.lcod.capsule.stimulus.StimulusSource;
import work.lcod.capsule.support.CapsuleTestSupport;

class DemoCapsuleTest {
    private final CapsuleCore capsule = new CapsuleCore(new DemoCapsule().definition());
    private final CapsuleTestSupport.RecordingListener listener = CapsuleTestSupport.recorder();

    @AfterEach
    void tearDown() {
        if (capsule.state() == CapsuleState.BOOTED) {
            capsule.shutdown();
        }
    }

    @Test
    void addKeepsIntegersIntegral() {
        capsule.boot();

        assertEquals(5L, capsule.trigger("math", "add", Map.of("a", 2, "b", 3)));
        assertEquals(2.5, capsule.trigger("math", "add", Map.of("a", 1, "b", 1.5)));
        assertEquals(4.0, capsule.trigger("math", "add", Map.of("a", "1", "b", 3)));
    }

    @Test
    void divisionByZeroIsAHandlerError() {
        capsule.boot();

        var error = assertThrows(HandlerException.class,
            () -> capsule.trigger("math", "divide", Map.of("a", 1, "b", 0)));
        assertEquals("Division by zero", error.getMessage());
        assertEquals(0.5, capsule.trigger("math", "divide", Map.of("a", 1, "b", 2)));
    }

    @Test
    void denyFlagIsRejectedByMiddleware() {
        capsule.boot();

        var error = assertThrows(MiddlewareRejectedException.class,
            () -> capsule.trigger("system", "echo", Map.of("deny", true)));
        assertEquals("Denied by request", error.reason());
    }

    @Test
    void countStreamsUpToTheBound() {
        capsule.boot();

        assertEquals(List.of(1L, 2L, 3L, 4L), CapsuleTestSupport.drain(capsule.stream("counter", "count", Map.of("to", 4), null)));
    }

    @Test
    void ticksComeFromABackgroundThreadWithStimuli() {
        capsule.onStimulus(listener);
        capsule.boot();

        var ticks = CapsuleTestSupport.drain(capsule.stream("counter", "ticks", Map.of("count", 3, "intervalMs", 1), null));

        assertEquals(List.of(1L, 2L, 3L), ticks);
        var stimuli = listener.ofSense(DemoCapsule.TICK_SENSE);
        assertEquals(3, stimuli.size());
        assertEquals(new StimulusSource("counter", "ticks"), stimuli.get(0).source());
        assertEquals(Map.of("tick", 1L), stimuli.get(0).data());
    }

    @Test
    void echoAndAnnounce() {
        capsule.onStimulus(listener);
        capsule.boot();

        assertEquals(Map.of("x", 1), capsule.trigger("system", "echo", Map.of("x", 1)));
        assertEquals(true, capsule.trigger("system", "announce", Map.of("hello", "world")));
        assertEquals(List.of(Map.of("hello", "world")),
            listener.ofSense(DemoCapsule.ANNOUNCE_SENSE).stream().map(Stimulus::data).toList());
    }

    @Test
    void lifecycleHooksEmitTheirPhase() {
        capsule.onStimulus(listener);
        capsule.boot();
        capsule.shutdown();

        assertEquals(List.of(Map.of("phase", "boot"), Map.of("phase", "shutdown")),
            listener.ofSense(DemoCapsule.LIFECYCLE_SENSE).stream().map(Stimulus::data).toList());
    }

    @Test
    void describeListsCapabilitiesAndSenses() {
        var metadata = capsule.describe();

        assertEquals(DemoCapsule.NAME, metadata.name());
        assertEquals(List.of("math", "counter", "system"),
            metadata.capabilities().stream().map(c -> c.name()).toList());
        assertEquals("stream", metadata.findOperation("counter", "ticks").orElseThrow().kind());
        assertTrue(metadata.senses().stream().anyMatch(s -> s.name().equals(DemoCapsule.TICK_SENSE)));
    }
}
