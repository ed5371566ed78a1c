package stratus.engine.service;

import stratus.engine.model.OperationStatus;

import java.time.Duration;

/**
 * What the pipeline did with one operation. Failures are thrown, not returned.
 *
 * @param status     COMPLETED or SKIPPED
 * @param recordId   operation history id
 * @param reason     why it was skipped, null when it ran
 * @param suspicious exit 0 without a success marker while validation was enabled
 */
public record OperationOutcome(String operationId, String recordId, OperationStatus status, String reason,
        boolean suspicious, Duration elapsed, String output) {

    public boolean skipped() {
        return status == OperationStatus.SKIPPED;
    }
}
