package stratus.engine.workflow;

import stratus.engine.model.OperationStatus;

import java.time.Instant;

/**
 * Persisted result of one workflow step.
 *
 * @param output   short result text: skip reason, error message or a trimmed command output
 * @param recordId operation history id, null when the step never reached the pipeline
 */
public record StepState(int index, String name, String operation, OperationStatus status, String output,
        Instant completedAt, String recordId) {

    static final String NOT_SELECTED = "not selected";

    /**
     * True when a resumed run must not execute this step again.
     */
    public boolean settled() {
        return status == OperationStatus.COMPLETED
                || (status == OperationStatus.SKIPPED && !NOT_SELECTED.equals(output));
    }
}
