package stratus.engine.workflow;

import stratus.engine.model.OperationStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * State of one workflow run. Immutable: every step produces a new instance that is persisted
 * before the next step starts.
 */
public final class WorkflowExecution {
    private final String executionId;
    private final String workflowId;
    private final String workflowName;
    private final Path workflowFile;
    private final ExecutionStatus status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final int totalSteps;
    private final Map<Integer, StepState> steps;
    private final String error;

    private WorkflowExecution(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "executionId is required");
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId is required");
        this.workflowName = builder.workflowName;
        this.workflowFile = builder.workflowFile;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.totalSteps = builder.totalSteps;
        this.steps = Collections.unmodifiableMap(new TreeMap<>(builder.steps));
        this.error = builder.error;
    }

    public String executionId() {
        return executionId;
    }

    public String workflowId() {
        return workflowId;
    }

    public String workflowName() {
        return workflowName;
    }

    public Path workflowFile() {
        return workflowFile;
    }

    public ExecutionStatus status() {
        return status;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public int totalSteps() {
        return totalSteps;
    }

    /** Step states keyed by 1-based index; steps that never started are absent. */
    public Map<Integer, StepState> steps() {
        return steps;
    }

    public String error() {
        return error;
    }

    public int completedCount() {
        return (int) steps.values().stream().filter(s -> s.status() == OperationStatus.COMPLETED).count();
    }

    public List<String> failedSteps() {
        return namesWith(OperationStatus.FAILED);
    }

    public List<String> skippedSteps() {
        return namesWith(OperationStatus.SKIPPED);
    }

    private List<String> namesWith(OperationStatus wanted) {
        List<String> names = new ArrayList<>();
        for (StepState step : steps.values()) {
            if (step.status() == wanted) {
                names.add(step.name());
            }
        }
        return names;
    }

    public WorkflowExecution withStep(StepState step) {
        Builder builder = toBuilder();
        builder.steps.put(step.index(), step);
        return builder.build();
    }

    public WorkflowExecution finish(ExecutionStatus finalStatus, Instant now, String failure) {
        return toBuilder().status(finalStatus).completedAt(now).error(failure).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .executionId(executionId)
                .workflowId(workflowId)
                .workflowName(workflowName)
                .workflowFile(workflowFile)
                .status(status)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .totalSteps(totalSteps)
                .steps(steps)
                .error(error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String executionId;
        private String workflowId;
        private String workflowName;
        private Path workflowFile;
        private ExecutionStatus status = ExecutionStatus.RUNNING;
        private Instant startedAt;
        private Instant completedAt;
        private int totalSteps;
        private final Map<Integer, StepState> steps = new TreeMap<>();
        private String error;

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder workflowFile(Path workflowFile) {
            this.workflowFile = workflowFile;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder totalSteps(int totalSteps) {
            this.totalSteps = totalSteps;
            return this;
        }

        public Builder steps(Map<Integer, StepState> steps) {
            this.steps.clear();
            this.steps.putAll(steps);
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public WorkflowExecution build() {
            return new WorkflowExecution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return executionId.equals(((WorkflowExecution) o).executionId);
    }

    @Override
    public int hashCode() {
        return executionId.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowExecution{id=" + executionId + ", workflow=" + workflowId + ", status=" + status
                + ", steps=" + steps.size() + "/" + totalSteps + "}";
    }
}
