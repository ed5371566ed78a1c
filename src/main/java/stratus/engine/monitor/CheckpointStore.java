package stratus.engine.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.model.Checkpoint;
import stratus.engine.model.OperationStatus;
import stratus.engine.model.ResumeDecision;
import stratus.engine.store.JsonFiles;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-operation checkpoint files, {@code checkpoint_<operationId>.json}.
 * One file per operation id, so concurrent runs of different operations never share a record.
 */
public final class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path directory;

    public CheckpointStore(Path directory) {
        this.directory = directory;
    }

    public Checkpoint checkpoint(String operationId, OperationStatus status, Duration duration, String logFile) {
        Checkpoint checkpoint = new Checkpoint(operationId, status,
                duration == null ? 0 : duration.toSeconds(), Instant.now(), logFile);
        ObjectNode node = JsonFiles.mapper().createObjectNode();
        node.put("operation_id", checkpoint.operationId());
        node.put("status", checkpoint.status().label());
        node.put("duration_seconds", checkpoint.durationSeconds());
        node.put("timestamp", checkpoint.timestamp().toString());
        if (logFile != null) {
            node.put("log_file", logFile);
        } else {
            node.putNull("log_file");
        }
        JsonFiles.writeAtomically(fileFor(operationId), node);
        log.debug("Checkpoint {} -> {}", operationId, status.label());
        return checkpoint;
    }

    public Optional<Checkpoint> find(String operationId) {
        return JsonFiles.read(fileFor(operationId)).map(node -> toCheckpoint(operationId, node));
    }

    /**
     * SKIP when the last checkpoint says completed; RETRY otherwise, including when none exists.
     */
    public ResumeDecision resume(String operationId) {
        Optional<Checkpoint> checkpoint = find(operationId);
        if (checkpoint.isPresent() && checkpoint.get().status() == OperationStatus.COMPLETED) {
            log.info("Checkpoint for {} is completed ({}), skipping", operationId, checkpoint.get().timestamp());
            return ResumeDecision.SKIP;
        }
        checkpoint.ifPresent(c -> log.info("Checkpoint for {} is {}, retrying", operationId, c.status().label()));
        return ResumeDecision.RETRY;
    }

    Path fileFor(String operationId) {
        return directory.resolve("checkpoint_" + operationId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }

    private static OperationStatus statusOf(String label) {
        try {
            return OperationStatus.fromLabel(label);
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable checkpoint status '{}', treating as failed", label);
            return OperationStatus.FAILED;
        }
    }

    private static Checkpoint toCheckpoint(String operationId, JsonNode node) {
        OperationStatus status = statusOf(node.path("status").asText(""));
        Instant timestamp = node.hasNonNull("timestamp") ? Instant.parse(node.get("timestamp").asText()) : null;
        String logFile = node.hasNonNull("log_file") ? node.get("log_file").asText() : null;
        return new Checkpoint(node.path("operation_id").asText(operationId), status,
                node.path("duration_seconds").asLong(0), timestamp, logFile);
    }
}
