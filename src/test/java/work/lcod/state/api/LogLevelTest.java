package work.lcod.state.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogLevelTest {
    @Test
    void defaultsToFatal() {
        assertEquals(LogLevel.FATAL, LogLevel.from(null));
        assertEquals(LogLevel.FATAL, LogLevel.from(" "));
    }

    @Test
    void parsesCaseInsensitively() {
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertTrue(LogLevel.from("Trace").printsTrace());
        assertFalse(LogLevel.from("info").printsTrace());
    }

    @Test
    void rejectsUnknownLevel() {
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}
