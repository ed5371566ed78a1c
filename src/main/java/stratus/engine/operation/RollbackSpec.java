package stratus.engine.operation;

import java.util.List;

/**
 * Compensating commands run in reverse order when execution fails.
 */
public record RollbackSpec(boolean enabled, List<String> steps) {

    public RollbackSpec {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static RollbackSpec none() {
        return new RollbackSpec(false, List.of());
    }
}
