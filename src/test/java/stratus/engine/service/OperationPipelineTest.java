package stratus.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import stratus.engine.TestProject;
import stratus.engine.client.FakeControlPlaneClient;
import stratus.engine.client.RemoteExecutionState;
import stratus.engine.config.Dependencies;
import stratus.engine.error.OperationExecutionException;
import stratus.engine.error.PrerequisiteNotMetException;
import stratus.engine.error.ValidationException;
import stratus.engine.model.Checkpoint;
import stratus.engine.model.LogLevel;
import stratus.engine.model.OperationLogEntry;
import stratus.engine.model.OperationRecord;
import stratus.engine.model.OperationStatus;
import stratus.engine.model.Resource;
import stratus.engine.operation.TemplateType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class OperationPipelineTest {

    private static final String VNET_ID = "/subscriptions/sub-1/resourceGroups/rg-avd/providers/Microsoft.Network/virtualNetworks/vnet-avd";

    @TempDir
    Path root;

    private FakeControlPlaneClient client;
    private Dependencies deps;
    private OperationPipeline pipeline;

    @BeforeEach
    void setUp() {
        TestProject.copyTo(root);
        client = new FakeControlPlaneClient();
        deps = TestProject.open(root, client);
        pipeline = deps.operationPipeline();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    @DisplayName("Create operation runs, checkpoints and records the created resource")
    void createRunsAndPersists() {
        OperationOutcome outcome = pipeline.run("vnet-create", Map.of(), PipelineOptions.defaults());

        assertEquals(OperationStatus.COMPLETED, outcome.status());
        assertFalse(outcome.suspicious());
        assertTrue(outcome.output().contains("[SUCCESS] vnet-create"));
        assertTrue(client.commands().contains("az network vnet show -g rg-avd -n vnet-avd"), "probe ran first");

        OperationRecord record = deps.operationRepository().findById(outcome.recordId()).orElseThrow();
        assertEquals(OperationStatus.COMPLETED, record.status());
        assertEquals("networking", record.capability());
        assertEquals("create", record.mode());
        assertNotNull(record.startedAt());
        assertNotNull(record.completedAt());
        assertTrue(record.id().startsWith("vnet-create_"));

        Checkpoint checkpoint = deps.checkpointStore().find("vnet-create").orElseThrow();
        assertEquals(OperationStatus.COMPLETED, checkpoint.status());

        Resource vnet = deps.resourceStateService().findById(VNET_ID).orElseThrow();
        assertTrue(vnet.managed());
        assertEquals("eastus", vnet.location());
        assertEquals("rg-avd", vnet.scope());
    }

    @Test
    void alreadySatisfiedIsSkippedWithoutRunning() {
        client.on("vnet show", 0, "{\"id\": \"" + VNET_ID + "\"}");

        OperationOutcome outcome = pipeline.run("vnet-create", Map.of(), PipelineOptions.defaults());

        assertTrue(outcome.skipped());
        assertEquals("already satisfied", outcome.reason());
        assertEquals(OperationStatus.SKIPPED,
                deps.operationRepository().findById(outcome.recordId()).orElseThrow().status());
        assertEquals(OperationStatus.COMPLETED, deps.checkpointStore().find("vnet-create").orElseThrow().status());
        assertTrue(deps.resourceStateService().findById(VNET_ID).isEmpty(), "nothing ran, nothing recorded");
    }

    @Test
    void forceBypassesProbeAndPrerequisites() {
        client.on("vnet show", 0, "{\"id\": \"" + VNET_ID + "\"}");

        OperationOutcome vnet = pipeline.run("vnet-create", Map.of(), new PipelineOptions(true, false, null));
        OperationOutcome subnet = pipeline.run("subnet-create", Map.of(), new PipelineOptions(true, false, null));

        assertEquals(OperationStatus.COMPLETED, vnet.status());
        assertEquals(OperationStatus.COMPLETED, subnet.status());
        assertTrue(client.commands().isEmpty(), "no probe with --force");
    }

    @Test
    void unmetPrerequisiteStopsBeforeAnyRecord() {
        assertThrows(PrerequisiteNotMetException.class,
                () -> pipeline.run("subnet-create", Map.of(), PipelineOptions.defaults()));

        assertTrue(deps.operationRepository().findRecent(10).isEmpty());

        pipeline.run("vnet-create", Map.of(), PipelineOptions.defaults());
        OperationOutcome subnet = pipeline.run("subnet-create", Map.of(), PipelineOptions.defaults());
        assertEquals(OperationStatus.COMPLETED, subnet.status());
        assertTrue(subnet.output().contains("10.0.1.0/24"), "address prefix comes from deployment.ini");
    }

    @Test
    void parameterProblemsAreRaisedBeforeSideEffects() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> pipeline.run("vnet-delete", Map.of(), PipelineOptions.defaults()));

        assertTrue(e.getMessage().contains("resource_id"), e.getMessage());
        assertTrue(deps.operationRepository().findRecent(10).isEmpty());
        assertTrue(deps.checkpointStore().find("vnet-delete").isEmpty());

        assertThrows(ValidationException.class,
                () -> pipeline.run("no-such-operation", Map.of(), PipelineOptions.defaults()));
    }

    @Test
    @DisplayName("Failure rolls back in reverse, records FAILED and rethrows")
    void failureRollsBackAndRecords() {
        Map<String, JsonNode> params = Map.of("should_fail", BooleanNode.TRUE);

        OperationExecutionException e = assertThrows(OperationExecutionException.class,
                () -> pipeline.run("nsg-create", params, PipelineOptions.defaults()));
        assertTrue(e.getMessage().contains("nsg-create"), e.getMessage());

        assertEquals(List.of(
                "az network nsg delete -g rg-avd -n nsg-avd",
                "az network nsg rule delete -g rg-avd --nsg-name nsg-avd -n allow-rdp"), client.commands());

        OperationRecord record = deps.operationRepository().findLatestByOperationId("nsg-create").orElseThrow();
        assertEquals(OperationStatus.FAILED, record.status());
        assertNotNull(record.errorMessage());
        assertEquals(OperationStatus.FAILED, deps.checkpointStore().find("nsg-create").orElseThrow().status());

        List<OperationLogEntry> logs = deps.operationRepository().findLogs(record.id());
        assertEquals(LogLevel.ERROR, logs.get(logs.size() - 1).level());
    }

    @Test
    void resumeSkipsCompletedCheckpoint() {
        pipeline.run("nsg-create", Map.of(), PipelineOptions.defaults());

        OperationOutcome resumed = pipeline.run("nsg-create", Map.of(), new PipelineOptions(false, true, "wf_1"));

        assertTrue(resumed.skipped());
        assertEquals("checkpoint already completed", resumed.reason());
        assertEquals("wf_1", deps.operationRepository().findById(resumed.recordId()).orElseThrow().parentId());
    }

    @Test
    void heartbeatOperationIsDispatchedRemotely() {
        client.thenState(RemoteExecutionState.SUCCEEDED,
                "[START] install-apps\n[PROGRESS] installing 7-Zip\n[SUCCESS] install-apps\n", 0);

        OperationOutcome outcome = pipeline.run("golden-image-install-apps", Map.of(), PipelineOptions.defaults());

        assertEquals(OperationStatus.COMPLETED, outcome.status());
        assertEquals(1, client.dispatched().size());
        assertEquals(TemplateType.POWERSHELL_VM_COMMAND, client.dispatched().get(0).type());
        assertEquals("vm-golden", client.dispatched().get(0).vmName());
        assertEquals("rg-avd", client.dispatched().get(0).resourceGroup());
    }

    @Test
    void deleteModeSoftDeletesTheResource() {
        pipeline.run("vnet-create", Map.of(), PipelineOptions.defaults());

        OperationOutcome outcome = pipeline.run("vnet-delete", Map.of("resource_id", TextNode.valueOf(VNET_ID)),
                PipelineOptions.defaults());

        assertEquals(OperationStatus.COMPLETED, outcome.status());
        assertTrue(deps.resourceStateService().findById(VNET_ID).orElseThrow().isDeleted());
        assertEquals(VNET_ID, deps.operationRepository().findById(outcome.recordId()).orElseThrow().resourceId());
    }
}
