package fun.ai.devhub.log;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @Test
    void testParsePriority() {
        assertEquals(LogLevel.ERROR, LogLevel.parse("Error: connect ECONNREFUSED"));
        assertEquals(LogLevel.ERROR, LogLevel.parse("build FAILED"));
        assertEquals(LogLevel.ERROR, LogLevel.parse("java.lang.NullPointerException"));
        // error 优先于 warn
        assertEquals(LogLevel.ERROR, LogLevel.parse("warning: error while compiling"));
        assertEquals(LogLevel.WARN, LogLevel.parse("Warning: deprecated option"));
        assertEquals(LogLevel.WARN, LogLevel.parse("[WARN] slow query"));
        assertEquals(LogLevel.DEBUG, LogLevel.parse("debug: cache hit"));
        assertEquals(LogLevel.DEBUG, LogLevel.parse("TRACE enter handler"));
        assertEquals(LogLevel.INFO, LogLevel.parse("Server listening on :3000"));
        assertEquals(LogLevel.INFO, LogLevel.parse(null));
    }

    @Test
    void testFromCode() {
        assertEquals(LogLevel.WARN, LogLevel.fromCode("warn"));
        assertEquals(LogLevel.ERROR, LogLevel.fromCode(" ERROR "));
        assertNull(LogLevel.fromCode(null));
        assertNull(LogLevel.fromCode("  "));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.fromCode("fatal"));
    }

    @Test
    void testExitReasonOf() {
        assertEquals(ExitReason.STOPPED, ExitReason.of(0));
        assertEquals(ExitReason.KILLED, ExitReason.of(null));
        assertEquals(ExitReason.CRASHED, ExitReason.of(1));
        assertEquals(ExitReason.CRASHED, ExitReason.of(-1));
    }
}
