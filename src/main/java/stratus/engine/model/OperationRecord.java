package stratus.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One execution attempt of an operation definition.
 * Created at dispatch, finalized at completion.
 */
public final class OperationRecord {
    private final String id;
    private final String operationId; // definition id
    private final String capability;
    private final String operationName;
    private final String mode;
    private final String resourceId;
    private final OperationStatus status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Long durationSeconds;
    private final String errorMessage;
    private final String parameters; // JSON snapshot, secrets masked
    private final String parentId;

    private OperationRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.operationId = Objects.requireNonNull(builder.operationId, "operationId is required");
        this.capability = builder.capability;
        this.operationName = builder.operationName;
        this.mode = builder.mode;
        this.resourceId = builder.resourceId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.durationSeconds = builder.durationSeconds;
        this.errorMessage = builder.errorMessage;
        this.parameters = builder.parameters;
        this.parentId = builder.parentId;
    }

    // Getters
    public String id() {
        return id;
    }

    public String operationId() {
        return operationId;
    }

    public String capability() {
        return capability;
    }

    public String operationName() {
        return operationName;
    }

    public String mode() {
        return mode;
    }

    public String resourceId() {
        return resourceId;
    }

    public OperationStatus status() {
        return status;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Long durationSeconds() {
        return durationSeconds;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String parameters() {
        return parameters;
    }

    public String parentId() {
        return parentId;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .operationId(operationId)
                .capability(capability)
                .operationName(operationName)
                .mode(mode)
                .resourceId(resourceId)
                .status(status)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationSeconds(durationSeconds)
                .errorMessage(errorMessage)
                .parameters(parameters)
                .parentId(parentId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String operationId;
        private String capability;
        private String operationName;
        private String mode;
        private String resourceId;
        private OperationStatus status = OperationStatus.PENDING;
        private Instant startedAt;
        private Instant completedAt;
        private Long durationSeconds;
        private String errorMessage;
        private String parameters;
        private String parentId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder operationId(String operationId) {
            this.operationId = operationId;
            return this;
        }

        public Builder capability(String capability) {
            this.capability = capability;
            return this;
        }

        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder status(OperationStatus status) {
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

        public Builder durationSeconds(Long durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder parameters(String parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public OperationRecord build() {
            return new OperationRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OperationRecord that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "OperationRecord{id='" + id + "', operation=" + operationId + ", status=" + status + "}";
    }
}
