package stratus.engine.model;

/**
 * Outcome of consulting a checkpoint before re-running an operation.
 */
public enum ResumeDecision {
    /** Checkpoint says completed, do not run again */
    SKIP,
    /** No checkpoint or any non-completed status */
    RETRY
}
