package stratus.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.error.StorageException;
import stratus.engine.model.OperationStatus;
import stratus.engine.store.JsonFiles;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One JSON document per workflow run, {@code <executionId>.json}.
 */
public class ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStore.class);

    private final Path directory;

    public ExecutionStore(Path directory) {
        this.directory = directory;
    }

    public void save(WorkflowExecution execution) {
        JsonFiles.writeAtomically(fileFor(execution.executionId()), toJson(execution));
    }

    public Optional<WorkflowExecution> find(String executionId) {
        return JsonFiles.read(fileFor(executionId)).map(ExecutionStore::fromJson);
    }

    /**
     * All stored runs, newest first. Unreadable files are logged and skipped.
     */
    public List<WorkflowExecution> list() {
        List<WorkflowExecution> executions = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return executions;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                try {
                    JsonFiles.read(file).map(ExecutionStore::fromJson).ifPresent(executions::add);
                } catch (RuntimeException e) {
                    log.warn("Skipping unreadable execution state {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list executions in " + directory, e);
        }
        executions.sort(Comparator.comparing(WorkflowExecution::startedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return executions;
    }

    Path fileFor(String executionId) {
        return directory.resolve(executionId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }

    static ObjectNode toJson(WorkflowExecution execution) {
        ObjectNode root = JsonFiles.mapper().createObjectNode();
        root.put("execution_id", execution.executionId());
        root.put("workflow_id", execution.workflowId());
        root.put("workflow_name", execution.workflowName());
        root.put("workflow_file", execution.workflowFile() == null ? null : execution.workflowFile().toString());
        root.put("status", execution.status().label());
        root.put("start_time", instant(execution.startedAt()));
        root.put("end_time", instant(execution.completedAt()));
        root.put("total_steps", execution.totalSteps());
        root.put("completed_steps", execution.completedCount());
        ArrayNode failed = root.putArray("failed_steps");
        execution.failedSteps().forEach(failed::add);
        ArrayNode skipped = root.putArray("skipped_steps");
        execution.skippedSteps().forEach(skipped::add);
        if (execution.error() != null) {
            root.put("error", execution.error());
        }

        ObjectNode steps = root.putObject("steps");
        for (StepState step : execution.steps().values()) {
            ObjectNode node = steps.putObject("step_" + step.index());
            node.put("index", step.index());
            node.put("name", step.name());
            node.put("operation", step.operation());
            node.put("status", step.status().label());
            node.put("output", step.output());
            node.put("completed_at", instant(step.completedAt()));
            node.put("record_id", step.recordId());
        }
        return root;
    }

    static WorkflowExecution fromJson(JsonNode root) {
        WorkflowExecution.Builder builder = WorkflowExecution.builder()
                .executionId(root.path("execution_id").asText())
                .workflowId(root.path("workflow_id").asText())
                .workflowName(text(root, "workflow_name"))
                .workflowFile(root.hasNonNull("workflow_file") ? Path.of(root.get("workflow_file").asText()) : null)
                .status(ExecutionStatus.fromLabel(root.path("status").asText("running")))
                .startedAt(parseInstant(root, "start_time"))
                .completedAt(parseInstant(root, "end_time"))
                .totalSteps(root.path("total_steps").asInt(0))
                .error(text(root, "error"));

        Iterator<Map.Entry<String, JsonNode>> fields = root.path("steps").fields();
        Map<Integer, StepState> steps = new TreeMap<>();
        while (fields.hasNext()) {
            JsonNode node = fields.next().getValue();
            StepState step = new StepState(
                    node.path("index").asInt(),
                    text(node, "name"),
                    text(node, "operation"),
                    OperationStatus.fromLabel(node.path("status").asText("failed")),
                    text(node, "output"),
                    parseInstant(node, "completed_at"),
                    text(node, "record_id"));
            steps.put(step.index(), step);
        }
        return builder.steps(steps).build();
    }

    private static String instant(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant parseInstant(JsonNode node, String field) {
        return node.hasNonNull(field) ? Instant.parse(node.get(field).asText()) : null;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
