package stratus.engine.workflow;

import stratus.engine.TestProject;
import stratus.engine.client.FakeControlPlaneClient;
import stratus.engine.config.Dependencies;
import stratus.engine.error.ValidationException;
import stratus.engine.model.OperationRecord;
import stratus.engine.model.OperationStatus;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class WorkflowOrchestratorTest {

    @TempDir
    Path root;

    private Dependencies deps;
    private WorkflowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        TestProject.copyTo(root);
        deps = TestProject.open(root, new FakeControlPlaneClient());
        orchestrator = deps.workflowOrchestrator();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private WorkflowDefinition workflow(String file) {
        return orchestrator.load(root.resolve("workflows").resolve(file));
    }

    @Test
    @DisplayName("All steps complete and every step is persisted with its record")
    void runsEveryStepInOrder() {
        WorkflowExecution run = orchestrator.execute(workflow("networking.yaml"), WorkflowRunOptions.defaults());

        assertEquals(ExecutionStatus.COMPLETED, run.status());
        assertEquals(3, run.completedCount());
        assertTrue(run.failedSteps().isEmpty());
        assertNotNull(run.completedAt());
        assertTrue(run.executionId().startsWith("wf_networking_"));

        StepState subnet = run.steps().get(2);
        assertEquals("subnet-create", subnet.operation());
        OperationRecord record = deps.operationRepository().findById(subnet.recordId()).orElseThrow();
        assertEquals(run.executionId(), record.parentId());

        WorkflowExecution stored = orchestrator.getStatus(run.executionId()).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, stored.status());
        assertEquals(run.steps(), stored.steps());
    }

    @Test
    void failingStepHaltsTheRun() {
        WorkflowExecution run = orchestrator.execute(workflow("networking-broken-nsg.yaml"),
                WorkflowRunOptions.defaults());

        assertEquals(ExecutionStatus.FAILED, run.status());
        assertEquals(OperationStatus.COMPLETED, run.steps().get(1).status());
        assertEquals(OperationStatus.FAILED, run.steps().get(2).status());
        assertTrue(run.steps().get(2).output().contains("exited with code 2"), run.steps().get(2).output());
        assertFalse(run.steps().containsKey(3), "later steps never start");
        assertTrue(run.error().startsWith("Step 2 (Network security group) failed"), run.error());
        assertTrue(deps.checkpointStore().find("subnet-create").isEmpty());
    }

    @Test
    void continueOnErrorRunsRemainingSteps() {
        WorkflowExecution run = orchestrator.execute(workflow("networking-tolerant.yaml"),
                WorkflowRunOptions.defaults());

        assertEquals(ExecutionStatus.COMPLETED, run.status());
        assertEquals(List.of("Network security group"), run.failedSteps());
        assertEquals(OperationStatus.COMPLETED, run.steps().get(3).status());
        assertEquals(2, run.completedCount());
    }

    @Test
    void resumeKeepsSettledStepsAndRetriesTheRest() throws Exception {
        WorkflowExecution failed = orchestrator.execute(workflow("networking-broken-nsg.yaml"),
                WorkflowRunOptions.defaults());
        String firstRecord = failed.steps().get(1).recordId();

        Path file = root.resolve("workflows").resolve("networking-broken-nsg.yaml");
        Files.writeString(file, Files.readString(file).replace("should_fail: true", "should_fail: false"));

        WorkflowExecution resumed = orchestrator.resume(failed.executionId());

        assertEquals(failed.executionId(), resumed.executionId());
        assertEquals(ExecutionStatus.COMPLETED, resumed.status());
        assertNull(resumed.error());
        assertEquals(firstRecord, resumed.steps().get(1).recordId(), "settled step is not run again");
        assertEquals(OperationStatus.COMPLETED, resumed.steps().get(2).status());
        assertEquals(OperationStatus.COMPLETED, resumed.steps().get(3).status());
    }

    @Test
    void onlySelectedStepsRun() {
        WorkflowExecution run = orchestrator.execute(workflow("networking.yaml"),
                new WorkflowRunOptions(false, false, Set.of(1)));

        assertEquals(ExecutionStatus.COMPLETED, run.status());
        assertEquals(OperationStatus.COMPLETED, run.steps().get(1).status());
        assertEquals(OperationStatus.SKIPPED, run.steps().get(2).status());
        assertEquals("not selected", run.steps().get(3).output());
        assertFalse(run.steps().get(3).settled());
        assertEquals(List.of("Session host subnet", "Network security group"), run.skippedSteps());
    }

    @Test
    void validateReportsUnresolvableOperations() throws Exception {
        Path file = root.resolve("workflows").resolve("mixed.yaml");
        Files.writeString(file, """
                workflow:
                  id: mixed
                  name: Mixed references
                  steps:
                    - name: By id
                      operation: vnet-create
                    - name: By path
                      operation: capabilities/networking/operations/03-nsg-create.yaml
                    - name: Missing
                      operation: route-table-create
                    - operation: vnet-delete
                """);
        WorkflowDefinition workflow = orchestrator.load(file);

        List<String> problems = orchestrator.problems(workflow);

        assertEquals(List.of("steps[3]: operation not found: route-table-create", "steps[4].name is required"),
                problems);
        assertThrows(ValidationException.class, () -> orchestrator.validate(workflow));
        assertTrue(orchestrator.problems(workflow("networking.yaml")).isEmpty());
    }

    @Test
    void missingOperationFailsOnlyThatStep() throws Exception {
        Path file = root.resolve("workflows").resolve("typo.yaml");
        Files.writeString(file, """
                workflow:
                  id: typo
                  name: Typo
                  steps:
                    - name: Typo
                      operation: vnet-craete
                      continue_on_error: true
                    - name: Virtual network
                      operation: vnet-create
                """);

        WorkflowExecution run = orchestrator.execute(orchestrator.load(file), WorkflowRunOptions.defaults());

        assertEquals(ExecutionStatus.COMPLETED, run.status());
        assertEquals("Operation not found: vnet-craete", run.steps().get(1).output());
        assertNull(run.steps().get(1).recordId());
    }

    @Test
    void rejectsWorkflowWithoutStepsAndUnknownExecutions() {
        WorkflowDefinition empty = new WorkflowDefinition("empty", "Empty", null, List.of(), null);

        assertThrows(ValidationException.class, () -> orchestrator.execute(empty, WorkflowRunOptions.defaults()));
        assertThrows(ValidationException.class, () -> orchestrator.resume("wf_missing_20260101_000000_abcd"));
        assertTrue(orchestrator.getStatus("wf_missing_20260101_000000_abcd").isEmpty());
    }

    @Test
    void submitRunsWorkflowsConcurrently() throws Exception {
        var network = orchestrator.submit(workflow("networking.yaml"), WorkflowRunOptions.defaults());
        var tolerant = orchestrator.submit(workflow("networking-tolerant.yaml"),
                new WorkflowRunOptions(false, false, Set.of(2)));

        assertEquals(ExecutionStatus.COMPLETED, network.get(60, TimeUnit.SECONDS).status());
        assertEquals(List.of("Network security group"), tolerant.get(60, TimeUnit.SECONDS).failedSteps());
        assertEquals(2, orchestrator.listExecutions().size());
    }
}
