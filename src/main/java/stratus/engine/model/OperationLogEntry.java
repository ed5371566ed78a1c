package stratus.engine.model;

import java.time.Instant;

/**
 * Append-only log line attached to an operation record.
 *
 * @param details free-form JSON metadata, may be null
 */
public record OperationLogEntry(String operationId, Instant loggedAt, LogLevel level, String message,
        String details) {
}
