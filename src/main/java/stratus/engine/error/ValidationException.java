package stratus.engine.error;

import java.util.List;

/**
 * Bad or missing parameter, unresolved template token or malformed definition.
 * Always raised before any side effect.
 */
public class ValidationException extends EngineException {

    private final List<String> problems;

    public ValidationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ValidationException(String message, List<String> problems) {
        super(message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
