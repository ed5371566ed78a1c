package stratus.engine.store;

import stratus.engine.config.EngineConfig;
import stratus.engine.model.LogLevel;
import stratus.engine.model.OperationLogEntry;
import stratus.engine.model.OperationRecord;
import stratus.engine.model.OperationStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOperationRepositoryTest {

    private static Database db;
    private static JdbcOperationRepository repo;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-operations;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcOperationRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanOperations() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM operations");
            st.execute("DELETE FROM operation_logs");
            conn.commit();
        }
    }

    private static OperationRecord record(String id, String operationId) {
        return OperationRecord.builder()
                .id(id)
                .operationId(operationId)
                .capability("networking")
                .operationName("Create VNet")
                .mode("FAST")
                .parameters("{\"vnet_name\":\"vnet-avd\"}")
                .build();
    }

    @Test
    void lifecyclePendingRunningCompleted() {
        repo.create(record("op-1", "vnet-create"));
        assertEquals(OperationStatus.PENDING, repo.findById("op-1").orElseThrow().status());

        Instant started = Instant.now();
        assertTrue(repo.markRunning("op-1", started));
        assertFalse(repo.markRunning("op-1", started), "only a PENDING record can start");

        assertTrue(repo.complete("op-1", OperationStatus.COMPLETED, started.plusSeconds(42), 42, null));

        OperationRecord done = repo.findById("op-1").orElseThrow();
        assertEquals(OperationStatus.COMPLETED, done.status());
        assertEquals(42L, done.durationSeconds());
        assertNull(done.errorMessage());
        assertEquals("networking", done.capability());
    }

    @Test
    void completeRejectsNonTerminalStatus() {
        repo.create(record("op-1", "vnet-create"));
        assertThrows(IllegalArgumentException.class,
                () -> repo.complete("op-1", OperationStatus.RUNNING, Instant.now(), 0, null));
    }

    @Test
    @DisplayName("failIfRunning leaves records finalized by their supervisor alone")
    void failIfRunningOnlyTouchesRunning() {
        repo.create(record("op-1", "vnet-create"));
        repo.markRunning("op-1", Instant.now());
        repo.create(record("op-2", "nsg-create"));
        repo.markRunning("op-2", Instant.now());
        repo.complete("op-2", OperationStatus.COMPLETED, Instant.now(), 1, null);

        assertTrue(repo.failIfRunning("op-1", "abandoned"));
        assertFalse(repo.failIfRunning("op-2", "abandoned"));

        assertEquals(OperationStatus.FAILED, repo.findById("op-1").orElseThrow().status());
        assertEquals("abandoned", repo.findById("op-1").orElseThrow().errorMessage());
        assertEquals(OperationStatus.COMPLETED, repo.findById("op-2").orElseThrow().status());
    }

    @Test
    void findLatestAndRunningBefore() {
        Instant old = Instant.now().minus(Duration.ofHours(8));
        repo.create(record("op-old", "vnet-create"));
        repo.markRunning("op-old", old);
        repo.create(record("op-new", "vnet-create"));
        repo.markRunning("op-new", Instant.now());

        assertEquals("op-new", repo.findLatestByOperationId("vnet-create").orElseThrow().id());
        assertTrue(repo.findLatestByOperationId("unknown").isEmpty());

        List<OperationRecord> stale = repo.findRunningStartedBefore(Instant.now().minus(Duration.ofHours(6)));
        assertEquals(1, stale.size());
        assertEquals("op-old", stale.get(0).id());

        assertEquals(2, repo.findByStatus(OperationStatus.RUNNING, 10).size());
        assertEquals(2, repo.findRecent(10).size());
    }

    @Test
    void logsAreReturnedInOrder() {
        repo.create(record("op-1", "vnet-create"));
        Instant t0 = Instant.now();
        repo.appendLog(new OperationLogEntry("op-1", t0, LogLevel.INFO, "Operation started", null));
        repo.appendLog(new OperationLogEntry("op-1", t0.plusSeconds(5), LogLevel.WARN, "No [SUCCESS] marker",
                "{\"suspicious\":true}"));

        List<OperationLogEntry> logs = repo.findLogs("op-1");
        assertEquals(2, logs.size());
        assertEquals(LogLevel.INFO, logs.get(0).level());
        assertEquals(LogLevel.WARN, logs.get(1).level());
        assertEquals("{\"suspicious\":true}", logs.get(1).details());
    }
}
