package statemigrator.cli;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConsoleOutputTest {

    @Test
    void formatsDurations() {
        assertEquals("0.4s", ConsoleOutput.formatDuration(Duration.ofMillis(400)));
        assertEquals("1h 1m", ConsoleOutput.formatDuration(Duration.ofMinutes(61)));
        assertEquals("2m 5s", ConsoleOutput.formatDuration(Duration.ofSeconds(125)));
    }
}
