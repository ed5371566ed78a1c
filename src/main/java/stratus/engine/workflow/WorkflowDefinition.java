package stratus.engine.workflow;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered list of operation invocations executed as one deployment unit.
 */
public record WorkflowDefinition(String id, String name, String description, List<WorkflowStep> steps,
        Path source) {

    public WorkflowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
