package stratus.engine.operation;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared type of an operation parameter.
 */
public enum ParameterType {
    STRING,
    BOOL,
    NUMBER,
    /** String whose value is masked in snapshots and logs */
    SECRET,
    OBJECT,
    ARRAY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ParameterType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.of(STRING);
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "string" -> Optional.of(STRING);
            case "bool", "boolean" -> Optional.of(BOOL);
            case "number", "integer", "int", "float" -> Optional.of(NUMBER);
            case "secret", "securestring" -> Optional.of(SECRET);
            case "object", "map" -> Optional.of(OBJECT);
            case "array", "list" -> Optional.of(ARRAY);
            default -> Optional.empty();
        };
    }
}
