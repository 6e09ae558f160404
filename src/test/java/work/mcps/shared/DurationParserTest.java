package work.mcps.shared;

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
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse("1H"));
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
    }

    @Test
    void zeroMeansNoDeadline() {
        assertEquals(Optional.of(Duration.ZERO), DurationParser.parse("0"));
    }

    @Test
    void blankIsAbsent() {
        assertEquals(Optional.empty(), DurationParser.parse("  "));
        assertEquals(Optional.empty(), DurationParser.parse(null));
    }

    @Test
    void rejectsGarbageAndNegativeValues() {
        var error = assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertEquals("Invalid duration: soon", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
    }
}
