package stratus.engine.client;

import java.util.List;

/**
 * Exit code and combined output of a synchronous control-plane call.
 */
public record CommandResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /**
     * True when the call succeeded and printed something other than an empty JSON value.
     */
    public boolean hasContent() {
        if (!succeeded() || output == null) {
            return false;
        }
        String trimmed = output.trim();
        return !trimmed.isEmpty() && !trimmed.equals("null") && !trimmed.equals("[]") && !trimmed.equals("{}");
    }

    public List<String> lines() {
        return output == null ? List.of() : output.lines().toList();
    }
}
