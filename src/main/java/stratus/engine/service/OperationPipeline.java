package stratus.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.error.EngineException;
import stratus.engine.error.ValidationException;
import stratus.engine.model.LogLevel;
import stratus.engine.model.OperationLogEntry;
import stratus.engine.model.OperationRecord;
import stratus.engine.model.OperationStatus;
import stratus.engine.model.ResumeDecision;
import stratus.engine.monitor.CheckpointStore;
import stratus.engine.monitor.MonitorResult;
import stratus.engine.monitor.OperationMonitor;
import stratus.engine.operation.DefinitionValidator;
import stratus.engine.operation.ExecutionMode;
import stratus.engine.operation.IdempotencyChecker;
import stratus.engine.operation.IdempotencyResult;
import stratus.engine.operation.OperationCatalog;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.operation.ParameterResolver;
import stratus.engine.operation.RenderedCommand;
import stratus.engine.operation.ResolvedParameters;
import stratus.engine.operation.TemplateRenderer;
import stratus.engine.repository.OperationRepository;
import stratus.engine.store.StorageRetry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Runs one operation definition end to end.
 * <p>
 * validate → resolve parameters → checkpoint (resume only) → prerequisites → idempotency →
 * render → record → supervise → post checks → checkpoint → persist resource.
 * Everything before the record is created is free of side effects apart from the read-only
 * idempotency probe. On failure the rollback steps run and the original error is rethrown.
 */
public class OperationPipeline {

    private static final Logger log = LoggerFactory.getLogger(OperationPipeline.class);

    private final OperationCatalog catalog;
    private final DefinitionValidator validator;
    private final ParameterResolver resolver;
    private final PrerequisiteChecker prerequisites;
    private final IdempotencyChecker idempotency;
    private final TemplateRenderer renderer;
    private final OperationMonitor monitor;
    private final PostCheckRunner postChecks;
    private final RollbackRunner rollback;
    private final CheckpointStore checkpoints;
    private final OperationRepository operations;
    private final ResourceStateService resources;
    private final StorageRetry retry;
    private final Clock clock;

    public OperationPipeline(OperationCatalog catalog, DefinitionValidator validator, ParameterResolver resolver,
                             PrerequisiteChecker prerequisites, IdempotencyChecker idempotency,
                             TemplateRenderer renderer, OperationMonitor monitor, PostCheckRunner postChecks,
                             RollbackRunner rollback, CheckpointStore checkpoints, OperationRepository operations,
                             ResourceStateService resources, StorageRetry retry, Clock clock) {
        this.catalog = catalog;
        this.validator = validator;
        this.resolver = resolver;
        this.prerequisites = prerequisites;
        this.idempotency = idempotency;
        this.renderer = renderer;
        this.monitor = monitor;
        this.postChecks = postChecks;
        this.rollback = rollback;
        this.checkpoints = checkpoints;
        this.operations = operations;
        this.resources = resources;
        this.retry = retry;
        this.clock = clock;
    }

    /**
     * Run a catalog operation by id.
     */
    public OperationOutcome run(String operationId, Map<String, JsonNode> userParams, PipelineOptions options) {
        OperationDefinition definition = catalog.findById(operationId)
                .orElseThrow(() -> new ValidationException("Unknown operation: " + operationId));
        return run(definition, userParams, options);
    }

    public OperationOutcome run(OperationDefinition definition, Map<String, JsonNode> userParams,
                                PipelineOptions options) {
        validator.validate(definition);
        ExecutionMode mode = definition.mode()
                .orElseThrow(() -> new ValidationException("Invalid operation_mode: " + definition.modeLabel()));
        ResolvedParameters params = resolver.resolve(definition, userParams == null ? Map.of() : userParams);
        log.info("Operation {} ({}) mode={} params={}", definition.id(), definition.name(), mode.label(), params);

        if (options.resume() && checkpoints.resume(definition.id()) == ResumeDecision.SKIP) {
            return skip(definition, mode, params, options, "checkpoint already completed");
        }

        if (options.force()) {
            log.warn("{}: --force set, bypassing prerequisites and idempotency probe", definition.id());
        } else {
            prerequisites.check(definition);
            IdempotencyResult probe = idempotency.check(definition, params);
            if (probe == IdempotencyResult.ALREADY_SATISFIED) {
                checkpoints.checkpoint(definition.id(), OperationStatus.COMPLETED, Duration.ZERO, null);
                return skip(definition, mode, params, options, "already satisfied");
            }
        }

        RenderedCommand command = renderer.render(definition, params);
        OperationRecord record = newRecord(definition, mode, params, options, OperationStatus.PENDING).build();
        retry.run("create operation " + record.id(), () -> operations.create(record));

        Instant startedAt = clock.instant();
        retry.call("start operation " + record.id(), () -> operations.markRunning(record.id(), startedAt));
        appendLog(record.id(), LogLevel.INFO, "Started " + definition.id() + " as " + command.category(), null);

        MonitorResult result;
        try {
            result = monitor.supervise(command, record.id(), definition.validationEnabled());
            postChecks.run(definition, params);
        } catch (EngineException e) {
            fail(definition, params, record, startedAt, e);
            throw e;
        }

        Duration elapsed = Duration.between(startedAt, clock.instant());
        retry.call("complete operation " + record.id(), () -> operations.complete(record.id(),
                OperationStatus.COMPLETED, clock.instant(), elapsed.toSeconds(), null));
        checkpoints.checkpoint(definition.id(), OperationStatus.COMPLETED, elapsed, logFile(result));
        if (result.suspicious()) {
            appendLog(record.id(), LogLevel.WARN, "Exit 0 without [SUCCESS] marker", null);
        }
        for (String warning : result.warnings()) {
            appendLog(record.id(), LogLevel.WARN, warning, null);
        }
        appendLog(record.id(), LogLevel.INFO, "Completed in " + elapsed.toSeconds() + "s", null);

        persistResource(definition, mode, params, result);
        log.info("Operation {} completed in {}s (record {})", definition.id(), elapsed.toSeconds(), record.id());
        return new OperationOutcome(definition.id(), record.id(), OperationStatus.COMPLETED, null,
                result.suspicious(), elapsed, result.output());
    }

    private OperationOutcome skip(OperationDefinition definition, ExecutionMode mode, ResolvedParameters params,
                                  PipelineOptions options, String reason) {
        Instant now = clock.instant();
        OperationRecord record = newRecord(definition, mode, params, options, OperationStatus.SKIPPED)
                .startedAt(now)
                .completedAt(now)
                .durationSeconds(0L)
                .build();
        retry.run("record skipped operation " + record.id(), () -> operations.create(record));
        appendLog(record.id(), LogLevel.INFO, "Skipped: " + reason, null);
        log.info("Operation {} skipped: {}", definition.id(), reason);
        return new OperationOutcome(definition.id(), record.id(), OperationStatus.SKIPPED, reason, false,
                Duration.ZERO, null);
    }

    private void fail(OperationDefinition definition, ResolvedParameters params, OperationRecord record,
                      Instant startedAt, EngineException error) {
        log.error("Operation {} failed: {}", definition.id(), error.getMessage());
        rollback.rollback(definition, params);
        Duration elapsed = Duration.between(startedAt, clock.instant());
        retry.call("fail operation " + record.id(), () -> operations.complete(record.id(), OperationStatus.FAILED,
                clock.instant(), elapsed.toSeconds(), error.getMessage()));
        checkpoints.checkpoint(definition.id(), OperationStatus.FAILED, elapsed, null);
        appendLog(record.id(), LogLevel.ERROR, error.getMessage(), error.getClass().getSimpleName());
    }

    private void persistResource(OperationDefinition definition, ExecutionMode mode, ResolvedParameters params,
                                 MonitorResult result) {
        switch (mode) {
            case CREATE, ADOPT, MODIFY -> ResourceJson.parseOutput(result.output())
                    .flatMap(ResourceJson::toResource)
                    .ifPresent(resource -> resources.recordManaged(resource, mode == ExecutionMode.ADOPT,
                            clock.instant()));
            case DELETE -> params.string("resource_id").ifPresent(resources::markDeleted);
            case VALIDATE -> {
                // read-only
            }
        }
    }

    private OperationRecord.Builder newRecord(OperationDefinition definition, ExecutionMode mode,
                                              ResolvedParameters params, PipelineOptions options,
                                              OperationStatus status) {
        return OperationRecord.builder()
                .id(RecordIds.next(definition.id(), clock.instant()))
                .operationId(definition.id())
                .capability(definition.capability())
                .operationName(definition.name())
                .mode(mode.label())
                .resourceId(params.string("resource_id").orElse(null))
                .status(status)
                .parameters(params.snapshot().toString())
                .parentId(options.parentId());
    }

    private void appendLog(String recordId, LogLevel level, String message, String details) {
        retry.run("append operation log", () ->
                operations.appendLog(new OperationLogEntry(recordId, clock.instant(), level, message, details)));
    }

    private static String logFile(MonitorResult result) {
        return result.logFile() == null ? null : result.logFile().toString();
    }
}
