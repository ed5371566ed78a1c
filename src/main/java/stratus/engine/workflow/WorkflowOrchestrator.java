package stratus.engine.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.error.EngineException;
import stratus.engine.error.ValidationException;
import stratus.engine.model.OperationStatus;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.service.OperationOutcome;
import stratus.engine.service.OperationPipeline;
import stratus.engine.service.PipelineOptions;
import stratus.engine.service.RecordIds;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes workflows step by step on the calling thread.
 * <p>
 * Step state is persisted after every step, before the next one starts, so a crash never
 * loses completed progress. A failing step without {@code continue_on_error} fails the run
 * and halts it; later steps are never started and stay absent from the stored state.
 */
public class WorkflowOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);
    private static final int MAX_OUTPUT_CHARS = 2000;

    private final WorkflowParser parser;
    private final OperationLocator locator;
    private final OperationPipeline pipeline;
    private final ExecutionStore executions;
    private final Clock clock;
    private final ExecutorService runners;

    public WorkflowOrchestrator(WorkflowParser parser, OperationLocator locator, OperationPipeline pipeline,
                                ExecutionStore executions, Clock clock) {
        this.parser = parser;
        this.locator = locator;
        this.pipeline = pipeline;
        this.executions = executions;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.runners = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stratus-workflow-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public WorkflowDefinition load(Path file) {
        return parser.parse(file);
    }

    /**
     * Static checks: id, name, at least one step, and every step names a resolvable operation.
     *
     * @return problems, empty when valid
     */
    public List<String> problems(WorkflowDefinition workflow) {
        List<String> problems = new ArrayList<>();
        if (workflow.id() == null) {
            problems.add("workflow.id is required");
        }
        if (workflow.name() == null) {
            problems.add("workflow.name is required");
        }
        if (workflow.steps().isEmpty()) {
            problems.add("workflow.steps must contain at least one step");
        }
        for (WorkflowStep step : workflow.steps()) {
            String where = "steps[" + step.index() + "]";
            if (step.name() == null) {
                problems.add(where + ".name is required");
            }
            if (step.operation() == null) {
                problems.add(where + ".operation is required");
            } else {
                try {
                    if (locator.locate(step.operation()).isEmpty()) {
                        problems.add(where + ": operation not found: " + step.operation());
                    }
                } catch (ValidationException e) {
                    problems.add(where + ": " + e.getMessage());
                }
            }
        }
        return problems;
    }

    public void validate(WorkflowDefinition workflow) {
        List<String> problems = problems(workflow);
        if (!problems.isEmpty()) {
            throw new ValidationException("Workflow " + workflow.source() + " is invalid", problems);
        }
    }

    /**
     * Run a workflow to completion or first fatal failure.
     */
    public WorkflowExecution execute(WorkflowDefinition workflow, WorkflowRunOptions options) {
        validateShape(workflow);
        WorkflowExecution execution = WorkflowExecution.builder()
                .executionId(RecordIds.next("wf_" + workflow.id(), clock.instant()))
                .workflowId(workflow.id())
                .workflowName(workflow.name())
                .workflowFile(workflow.source() == null ? null : workflow.source().toAbsolutePath())
                .startedAt(clock.instant())
                .totalSteps(workflow.steps().size())
                .build();
        executions.save(execution);
        log.info("Workflow {} ({}) started as {} with {} steps", workflow.id(), workflow.name(),
                execution.executionId(), workflow.steps().size());
        return runSteps(workflow, execution, options);
    }

    /**
     * Re-run a stored execution in place. Settled steps are kept, the rest run again.
     */
    public WorkflowExecution resume(String executionId) {
        WorkflowExecution stored = executions.find(executionId)
                .orElseThrow(() -> new ValidationException("Unknown execution: " + executionId));
        if (stored.workflowFile() == null) {
            throw new ValidationException("Execution " + executionId + " has no workflow file to resume from");
        }
        WorkflowDefinition workflow = parser.parse(stored.workflowFile());
        validateShape(workflow);
        WorkflowExecution reopened = stored.toBuilder()
                .status(ExecutionStatus.RUNNING)
                .completedAt(null)
                .error(null)
                .totalSteps(workflow.steps().size())
                .build();
        executions.save(reopened);
        log.info("Resuming {} ({} of {} steps settled)", executionId,
                reopened.steps().values().stream().filter(StepState::settled).count(), workflow.steps().size());
        return runSteps(workflow, reopened, new WorkflowRunOptions(false, true, null));
    }

    /**
     * Run on a dedicated thread; independent runs proceed concurrently.
     */
    public CompletableFuture<WorkflowExecution> submit(WorkflowDefinition workflow, WorkflowRunOptions options) {
        return CompletableFuture.supplyAsync(() -> execute(workflow, options), runners);
    }

    public Optional<WorkflowExecution> getStatus(String executionId) {
        return executions.find(executionId);
    }

    public List<WorkflowExecution> listExecutions() {
        return executions.list();
    }

    private WorkflowExecution runSteps(WorkflowDefinition workflow, WorkflowExecution execution,
                                       WorkflowRunOptions options) {
        PipelineOptions pipelineOptions = new PipelineOptions(options.force(), options.resume(),
                execution.executionId());
        WorkflowExecution current = execution;

        for (WorkflowStep step : workflow.steps()) {
            StepState previous = current.steps().get(step.index());
            if (previous != null && previous.settled()) {
                log.info("[{}/{}] {}: already {}, skipping", step.index(), workflow.steps().size(), step.name(),
                        previous.status().label());
                continue;
            }
            if (!options.selected(step.index())) {
                current = save(current.withStep(state(step, OperationStatus.SKIPPED, StepState.NOT_SELECTED, null)));
                continue;
            }

            log.info("[{}/{}] {} -> {}", step.index(), workflow.steps().size(), step.name(), step.operation());
            StepState result = runStep(step, pipelineOptions);
            current = save(current.withStep(result));

            if (result.status() == OperationStatus.FAILED) {
                if (!step.continueOnError()) {
                    log.error("Workflow {} failed at step {} ({}): {}", workflow.id(), step.index(), step.name(),
                            result.output());
                    return save(current.finish(ExecutionStatus.FAILED, clock.instant(),
                            "Step " + step.index() + " (" + step.name() + ") failed: " + result.output()));
                }
                log.warn("Step {} ({}) failed, continuing (continue_on_error): {}", step.index(), step.name(),
                        result.output());
            }
        }

        WorkflowExecution finished = save(current.finish(ExecutionStatus.COMPLETED, clock.instant(), null));
        if (finished.failedSteps().isEmpty()) {
            log.info("Workflow {} completed ({} steps)", workflow.id(), finished.completedCount());
        } else {
            log.warn("Workflow {} completed with failed steps {}", workflow.id(), finished.failedSteps());
        }
        return finished;
    }

    private StepState runStep(WorkflowStep step, PipelineOptions options) {
        Optional<OperationDefinition> definition;
        try {
            definition = locator.locate(step.operation());
        } catch (ValidationException e) {
            return state(step, OperationStatus.FAILED, e.getMessage(), null);
        }
        if (definition.isEmpty()) {
            return state(step, OperationStatus.FAILED, "Operation not found: " + step.operation(), null);
        }
        try {
            OperationOutcome outcome = pipeline.run(definition.get(), step.parameters(), options);
            String output = outcome.skipped() ? outcome.reason() : trim(outcome.output());
            return state(step, outcome.status(), output, outcome.recordId());
        } catch (EngineException e) {
            return state(step, OperationStatus.FAILED, e.getMessage(), null);
        }
    }

    private StepState state(WorkflowStep step, OperationStatus status, String output, String recordId) {
        return new StepState(step.index(), step.name(), step.operation(), status, output, clock.instant(), recordId);
    }

    private WorkflowExecution save(WorkflowExecution execution) {
        executions.save(execution);
        return execution;
    }

    private static void validateShape(WorkflowDefinition workflow) {
        if (workflow.id() == null || workflow.name() == null || workflow.steps().isEmpty()) {
            throw new ValidationException("Workflow " + workflow.source() + " needs an id, a name and at least one step");
        }
    }

    private static String trim(String output) {
        if (output == null) {
            return null;
        }
        String trimmed = output.strip();
        return trimmed.length() <= MAX_OUTPUT_CHARS ? trimmed : trimmed.substring(trimmed.length() - MAX_OUTPUT_CHARS);
    }

    @Override
    public void close() {
        runners.shutdown();
        try {
            if (!runners.awaitTermination(5, TimeUnit.SECONDS)) {
                runners.shutdownNow();
            }
        } catch (InterruptedException e) {
            runners.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
