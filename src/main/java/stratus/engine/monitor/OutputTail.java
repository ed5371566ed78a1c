package stratus.engine.monitor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Last N lines of supervised output, plus a size-capped copy of the whole output.
 */
final class OutputTail {

    static final int DEFAULT_LINES = 20;
    private static final int MAX_CAPTURE_CHARS = 256 * 1024;

    private final int capacity;
    private final Deque<String> lines = new ArrayDeque<>();
    private final StringBuilder captured = new StringBuilder();
    private boolean truncated;

    OutputTail(int capacity) {
        this.capacity = capacity;
    }

    void add(String line) {
        if (lines.size() == capacity) {
            lines.removeFirst();
        }
        lines.addLast(line);
        if (captured.length() + line.length() + 1 <= MAX_CAPTURE_CHARS) {
            captured.append(line).append('\n');
        } else {
            truncated = true;
        }
    }

    List<String> lines() {
        return List.copyOf(lines);
    }

    String captured() {
        return captured.toString();
    }

    boolean truncated() {
        return truncated;
    }
}
