package stratus.engine.workflow;

import java.util.Set;

/**
 * @param force     bypass idempotency probes and prerequisite gates
 * @param resume    skip steps whose operation checkpoint is completed
 * @param onlySteps 1-based step indexes to run; empty means all
 */
public record WorkflowRunOptions(boolean force, boolean resume, Set<Integer> onlySteps) {

    public WorkflowRunOptions {
        onlySteps = onlySteps == null ? Set.of() : Set.copyOf(onlySteps);
    }

    public static WorkflowRunOptions defaults() {
        return new WorkflowRunOptions(false, false, Set.of());
    }

    boolean selected(int index) {
        return onlySteps.isEmpty() || onlySteps.contains(index);
    }
}
