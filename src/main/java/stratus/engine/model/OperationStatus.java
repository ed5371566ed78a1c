package stratus.engine.model;

/**
 * Lifecycle status of an operation execution.
 */
public enum OperationStatus {
    /** Record created, not yet dispatched */
    PENDING,
    /** Being supervised */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Finished with an error, timeout or hang */
    FAILED,
    /** Not executed (already satisfied, resumed past, or deselected) */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /** Lower-case form used in documents and checkpoints. */
    public String label() {
        return name().toLowerCase();
    }

    public static OperationStatus fromLabel(String label) {
        return valueOf(label.trim().toUpperCase());
    }
}
