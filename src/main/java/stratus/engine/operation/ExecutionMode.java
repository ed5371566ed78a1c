package stratus.engine.operation;

import java.util.Locale;
import java.util.Optional;

/**
 * What an operation does to its target.
 */
public enum ExecutionMode {
    /** Create a new resource */
    CREATE,
    /** Take ownership of an existing resource */
    ADOPT,
    /** Change an existing resource */
    MODIFY,
    /** Read-only verification */
    VALIDATE,
    /** Remove a resource */
    DELETE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ExecutionMode> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (ExecutionMode mode : values()) {
            if (mode.name().equalsIgnoreCase(label.trim())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
