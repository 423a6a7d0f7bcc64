package fun.ai.devhub.process;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogLineBufferTest {

    private LogLineBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new LogLineBuffer();
    }

    @Test
    void testSplitsCompleteLines() {
        assertEquals(List.of("a", "b"), buffer.append("a\nb\n"));
        assertTrue(buffer.flush().isEmpty());
    }

    @Test
    void testPartialLineCarriedToNextChunk() {
        assertEquals(List.of("first"), buffer.append("first\nsec"));
        assertEquals(List.of("second"), buffer.append("ond\n"));
        assertEquals(List.of(), buffer.append("tail"));
        assertEquals(List.of("tail"), buffer.flush());
    }

    @Test
    void testStripsAnsiAndDropsBlankLines() {
        List<String> lines = buffer.append("\u001B[32mready\u001B[0m in 300ms\n\n   \n\u001B[1m\u001B[0m\n");
        assertEquals(List.of("ready in 300ms"), lines);
    }

    @Test
    void testCrlfAndCarriageReturnOverwrite() {
        assertEquals(List.of("windows line"), buffer.append("windows line\r\n"));
        // 进度条式覆写只保留最后一段
        assertEquals(List.of("100%"), buffer.append("10%\r50%\r100%\n"));
    }

    @Test
    void testStripAnsi() {
        assertEquals("plain", LogLineBuffer.stripAnsi("plain"));
        assertEquals("red", LogLineBuffer.stripAnsi("\u001B[31;1mred\u001B[0m"));
        assertEquals("title gone", LogLineBuffer.stripAnsi("\u001B]0;my title\u0007title gone"));
        assertNull(LogLineBuffer.stripAnsi(null));
    }
}
