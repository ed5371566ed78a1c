package stratus.engine.service;

import stratus.engine.error.PrerequisiteNotMetException;
import stratus.engine.model.OperationStatus;
import stratus.engine.monitor.CheckpointStore;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.operation.Prerequisite;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteCheckerTest {

    @TempDir
    Path dir;

    private CheckpointStore checkpoints;
    private PrerequisiteChecker checker;

    @BeforeEach
    void setUp() {
        checkpoints = new CheckpointStore(dir);
        checker = new PrerequisiteChecker(checkpoints);
    }

    private static OperationDefinition requiring(Prerequisite... prerequisites) {
        return OperationDefinition.builder()
                .id("subnet-create")
                .name("Create subnet")
                .requires(List.of(prerequisites))
                .build();
    }

    @Test
    void passesWhenEveryPrerequisiteHasItsStatus() {
        checkpoints.checkpoint("vnet-create", OperationStatus.COMPLETED, Duration.ofSeconds(12), null);
        checkpoints.checkpoint("nsg-create", OperationStatus.SKIPPED, Duration.ZERO, null);

        List<Prerequisite> unmet = checker.check(requiring(
                Prerequisite.required("vnet-create"),
                new Prerequisite("nsg-create", OperationStatus.SKIPPED, false)));

        assertTrue(unmet.isEmpty());
    }

    @Test
    void failsOnRequiredPrerequisiteThatNeverRan() {
        PrerequisiteNotMetException e = assertThrows(PrerequisiteNotMetException.class,
                () -> checker.check(requiring(Prerequisite.required("vnet-create"))));

        assertEquals("subnet-create", e.operationId());
        assertEquals("vnet-create", e.prerequisite());
        assertTrue(e.getMessage().contains("not run"), e.getMessage());
    }

    @Test
    void failsWhenStatusDiffers() {
        checkpoints.checkpoint("vnet-create", OperationStatus.FAILED, Duration.ofSeconds(3), null);

        PrerequisiteNotMetException e = assertThrows(PrerequisiteNotMetException.class,
                () -> checker.check(requiring(Prerequisite.required("vnet-create"))));

        assertTrue(e.getMessage().contains("failed"), e.getMessage());
    }

    @Test
    void optionalPrerequisiteOnlyWarns() {
        checkpoints.checkpoint("vnet-create", OperationStatus.COMPLETED, Duration.ofSeconds(12), null);
        Prerequisite dns = new Prerequisite("private-dns-create", OperationStatus.COMPLETED, true);

        List<Prerequisite> unmet = checker.check(requiring(Prerequisite.required("vnet-create"), dns));

        assertEquals(List.of(dns), unmet);
    }
}
