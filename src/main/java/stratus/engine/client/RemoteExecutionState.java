package stratus.engine.client;

import java.util.Locale;

/**
 * Execution state as reported by the remote dispatcher.
 */
public enum RemoteExecutionState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELED;
    }

    public static RemoteExecutionState fromDispatcher(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "pending", "notstarted", "accepted" -> PENDING;
            case "running", "inprogress" -> RUNNING;
            case "succeeded", "success", "completed" -> SUCCEEDED;
            case "failed", "timedout", "error" -> FAILED;
            case "canceled", "cancelled" -> CANCELED;
            default -> UNKNOWN;
        };
    }
}
