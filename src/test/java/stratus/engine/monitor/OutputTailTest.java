package stratus.engine.monitor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputTailTest {

    @Test
    void keepsOnlyLastLines() {
        OutputTail tail = new OutputTail(3);
        for (int i = 1; i <= 5; i++) {
            tail.add("line " + i);
        }

        assertEquals(List.of("line 3", "line 4", "line 5"), tail.lines());
        assertTrue(tail.captured().startsWith("line 1\n"));
        assertFalse(tail.truncated());
    }

    @Test
    void captureIsCapped() {
        OutputTail tail = new OutputTail(OutputTail.DEFAULT_LINES);
        String block = "x".repeat(64 * 1024);
        for (int i = 0; i < 5; i++) {
            tail.add(block);
        }

        assertTrue(tail.truncated());
        assertTrue(tail.captured().length() <= 256 * 1024);
        assertEquals(5, tail.lines().size());
    }
}
