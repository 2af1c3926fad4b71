package work.lcod.capsule.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class CapsuleConfigTest {
    @Test
    void defaultsMatchTheDocumentedValues() {
        var config = CapsuleConfig.defaults();

        assertEquals(Duration.ofSeconds(10), config.bootTimeout());
        assertEquals(Duration.ofSeconds(2), config.shutdownTimeout());
        assertEquals(Duration.ofSeconds(5), config.drainTimeout());
        assertEquals(LogLevel.INFO, config.logLevel());
    }

    @Test
    void toBuilderKeepsUntouchedValues() {
        var config = CapsuleConfig.defaults().toBuilder().drainTimeout(Duration.ZERO).build();

        assertEquals(Duration.ZERO, config.drainTimeout());
        assertEquals(CapsuleConfig.DEFAULT_BOOT_TIMEOUT, config.bootTimeout());
    }

    @Test
    void rejectsNonPositiveTimeouts() {
        assertThrows(IllegalArgumentException.class, () -> CapsuleConfig.builder().bootTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> CapsuleConfig.builder().drainTimeout(Duration.ofMillis(-1)).build());
    }

    @Test
    void logLevelsParseCaseInsensitively() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" Debug "));
        assertEquals(LogLevel.INFO, LogLevel.from(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("verbose"));
        assertEquals("shutdown", CapsuleState.SHUTDOWN.toString());
    }
}
