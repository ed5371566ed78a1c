package stratus.engine.model;

import java.time.Instant;

/**
 * Last known terminal status of an operation, used to decide skip versus retry.
 */
public record Checkpoint(String operationId, OperationStatus status, long durationSeconds, Instant timestamp,
        String logFile) {
}
