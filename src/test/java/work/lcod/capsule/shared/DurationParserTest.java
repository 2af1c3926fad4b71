package work.lcod.capsule.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parse("1H").orElseThrow());
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
        assertEquals(Duration.ofMillis(250), DurationParser.parse(" 250 ms ").orElseThrow());
    }

    @Test
    void handlesZero() {
        assertEquals(Duration.ZERO, DurationParser.parse("0").orElseThrow());
    }

    @Test
    void blankMeansAbsent() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertEquals(Duration.ofSeconds(5), DurationParser.parseOrDefault(null, "drain", Duration.ofSeconds(5)));
    }

    @Test
    void rejectsUnknownUnitsNamingTheKey() {
        var error = assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("3 days", "--drain-timeout"));
        assertTrue(error.getMessage().startsWith("Invalid --drain-timeout: '3 days'"), error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-1s"));
    }
}
