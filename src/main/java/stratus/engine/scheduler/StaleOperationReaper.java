package stratus.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.model.OperationRecord;
import stratus.engine.model.OperationStatus;
import stratus.engine.monitor.CheckpointStore;
import stratus.engine.repository.OperationRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that fails operation records left RUNNING by a supervisor that died.
 * <p>
 * A record RUNNING longer than the abandoned threshold is failed only if it is still RUNNING
 * at update time, and its checkpoint is set to failed so that a resume retries it.
 */
public class StaleOperationReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleOperationReaper.class);

    private final OperationRepository operations;
    private final CheckpointStore checkpoints;
    private final Duration threshold;
    private final Clock clock;

    public StaleOperationReaper(OperationRepository operations, CheckpointStore checkpoints, Duration threshold,
                                Clock clock) {
        this.operations = operations;
        this.checkpoints = checkpoints;
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapAbandoned();
        } catch (Exception e) {
            log.error("Operation reaper error", e);
        }
    }

    /**
     * @return number of records failed
     */
    public int reapAbandoned() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(threshold);
        List<OperationRecord> abandoned = operations.findRunningStartedBefore(cutoff);

        if (abandoned.isEmpty()) {
            log.debug("No abandoned operations found");
            return 0;
        }

        int failed = 0;
        for (OperationRecord record : abandoned) {
            try {
                String reason = "abandoned: running since " + record.startedAt() + " without completion";
                if (operations.failIfRunning(record.id(), reason)) {
                    Duration ran = record.startedAt() == null ? Duration.ZERO : Duration.between(record.startedAt(), now);
                    checkpoints.checkpoint(record.operationId(), OperationStatus.FAILED, ran, null);
                    failed++;
                    log.warn("Operation record {} ({}) marked failed: {}", record.id(), record.operationId(), reason);
                }
            } catch (Exception e) {
                log.error("Failed to reap operation record {}", record.id(), e);
            }
        }

        log.info("Operation reaper: {} failed, {} candidates", failed, abandoned.size());
        return failed;
    }
}
