package stratus.engine.operation;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, parsed operation definition document.
 * The execution mode is kept as written so validation can report an unknown mode
 * instead of failing at parse time.
 */
public final class OperationDefinition {
    private final String id;
    private final String name;
    private final String description;
    private final String capability;
    private final String modeLabel;
    private final String resourceType;
    private final String resourceName;
    private final DurationSpec duration;
    private final boolean validationEnabled;
    private final List<PostCheck> checks;
    private final TemplateSpec template;
    private final IdempotencySpec idempotency;
    private final RollbackSpec rollback;
    private final List<Prerequisite> requires;
    private final Map<String, ParameterSpec> parameters;
    private final Path source;

    private OperationDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.description = builder.description;
        this.capability = builder.capability;
        this.modeLabel = builder.modeLabel;
        this.resourceType = builder.resourceType;
        this.resourceName = builder.resourceName;
        this.duration = builder.duration != null ? builder.duration : DurationSpec.defaults();
        this.validationEnabled = builder.validationEnabled;
        this.checks = builder.checks != null ? List.copyOf(builder.checks) : List.of();
        this.template = builder.template;
        this.idempotency = builder.idempotency != null ? builder.idempotency : IdempotencySpec.none();
        this.rollback = builder.rollback != null ? builder.rollback : RollbackSpec.none();
        this.requires = builder.requires != null ? List.copyOf(builder.requires) : List.of();
        this.parameters = builder.parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters))
                : Map.of();
        this.source = builder.source;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String capability() {
        return capability;
    }

    public String modeLabel() {
        return modeLabel;
    }

    /** Parsed mode; defaults to CREATE when the document omits it. */
    public Optional<ExecutionMode> mode() {
        return modeLabel == null ? Optional.of(ExecutionMode.CREATE) : ExecutionMode.fromLabel(modeLabel);
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceName() {
        return resourceName;
    }

    public DurationSpec duration() {
        return duration;
    }

    public boolean validationEnabled() {
        return validationEnabled;
    }

    public List<PostCheck> checks() {
        return checks;
    }

    public TemplateSpec template() {
        return template;
    }

    public IdempotencySpec idempotency() {
        return idempotency;
    }

    public RollbackSpec rollback() {
        return rollback;
    }

    public List<Prerequisite> requires() {
        return requires;
    }

    /** Parameter schema by name, in declaration order. */
    public Map<String, ParameterSpec> parameters() {
        return parameters;
    }

    public Path source() {
        return source;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String capability;
        private String modeLabel;
        private String resourceType;
        private String resourceName;
        private DurationSpec duration;
        private boolean validationEnabled;
        private List<PostCheck> checks;
        private TemplateSpec template;
        private IdempotencySpec idempotency;
        private RollbackSpec rollback;
        private List<Prerequisite> requires;
        private Map<String, ParameterSpec> parameters;
        private Path source;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder capability(String capability) {
            this.capability = capability;
            return this;
        }

        public Builder modeLabel(String modeLabel) {
            this.modeLabel = modeLabel;
            return this;
        }

        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }

        public Builder resourceName(String resourceName) {
            this.resourceName = resourceName;
            return this;
        }

        public Builder duration(DurationSpec duration) {
            this.duration = duration;
            return this;
        }

        public Builder validationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
            return this;
        }

        public Builder checks(List<PostCheck> checks) {
            this.checks = checks;
            return this;
        }

        public Builder template(TemplateSpec template) {
            this.template = template;
            return this;
        }

        public Builder idempotency(IdempotencySpec idempotency) {
            this.idempotency = idempotency;
            return this;
        }

        public Builder rollback(RollbackSpec rollback) {
            this.rollback = rollback;
            return this;
        }

        public Builder requires(List<Prerequisite> requires) {
            this.requires = requires;
            return this;
        }

        public Builder parameters(Map<String, ParameterSpec> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public OperationDefinition build() {
            return new OperationDefinition(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OperationDefinition that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "OperationDefinition{id='" + id + "', mode=" + modeLabel + ", category=" + duration.category() + "}";
    }
}
