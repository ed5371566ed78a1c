package stratus.engine.model;

import java.time.Instant;

/**
 * Duration of one settled operation record.
 */
public record OperationTiming(String recordId, String operationId, String capability, String mode,
                              OperationStatus status, long durationSeconds, Instant completedAt) {
}
