package stratus.engine.workflow;

import java.util.Locale;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExecutionStatus fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
