package stratus.engine.model;

import java.util.Locale;

/**
 * How an operation is supervised.
 */
public enum OperationCategory {
    /** Local child process, tight polling */
    FAST,
    /** Local child process, longer polling interval */
    WAIT,
    /** Asynchronous remote dispatch watched through a heartbeat artifact */
    HEARTBEAT;

    public static OperationCategory fromLabel(String label) {
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operation category: " + label);
        }
    }
}
