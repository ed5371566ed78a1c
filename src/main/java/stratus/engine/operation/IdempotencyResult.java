package stratus.engine.operation;

/**
 * Outcome of an idempotency probe.
 */
public enum IdempotencyResult {
    /** No probe declared, or probe bypassed */
    NOT_CHECKED,
    /** Probe says the target is not there yet */
    NOT_SATISFIED,
    /** Target already exists but the definition does not ask to skip */
    SATISFIED_NO_SKIP,
    /** Target already exists; rendering and execution are skipped */
    ALREADY_SATISFIED
}
