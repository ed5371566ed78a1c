package stratus.engine.repository;

import stratus.engine.model.OperationLogEntry;
import stratus.engine.model.OperationRecord;
import stratus.engine.model.OperationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for operation history and operation logs.
 */
public interface OperationRepository {

    /**
     * Create a new operation record.
     *
     * @param record the record
     */
    void create(OperationRecord record);

    /**
     * Move a record to RUNNING.
     *
     * @param id        the record id
     * @param startedAt dispatch time
     * @return true if updated
     */
    boolean markRunning(String id, Instant startedAt);

    /**
     * Finalize a record with a terminal status.
     *
     * @param id              the record id
     * @param status          terminal status
     * @param completedAt     completion time
     * @param durationSeconds elapsed seconds
     * @param errorMessage    failure reason, null on success
     * @return true if updated
     */
    boolean complete(String id, OperationStatus status, Instant completedAt, long durationSeconds,
            String errorMessage);

    /**
     * Fail a record only if it is still RUNNING. Used by the reaper, so a record finalized
     * concurrently by its supervisor is left untouched.
     *
     * @param id           the record id
     * @param errorMessage failure reason
     * @return true if the record was still running and is now failed
     */
    boolean failIfRunning(String id, String errorMessage);

    Optional<OperationRecord> findById(String id);

    /**
     * Most recent record for an operation definition.
     *
     * @param operationId the definition id
     * @return latest attempt if any
     */
    Optional<OperationRecord> findLatestByOperationId(String operationId);

    List<OperationRecord> findByStatus(OperationStatus status, int limit);

    /**
     * Records still RUNNING that started before the cutoff.
     *
     * @param startedBefore cutoff
     * @return candidate abandoned records
     */
    List<OperationRecord> findRunningStartedBefore(Instant startedBefore);

    List<OperationRecord> findRecent(int limit);

    /**
     * Append a log entry to an operation.
     *
     * @param entry the entry
     */
    void appendLog(OperationLogEntry entry);

    /**
     * Log entries of an operation in chronological order.
     *
     * @param operationId the record id
     * @return entries
     */
    List<OperationLogEntry> findLogs(String operationId);
}
