package stratus.engine.store;

import stratus.engine.config.EngineConfig;
import stratus.engine.model.DependencyEdge;
import stratus.engine.model.DependencyKind;
import stratus.engine.model.Relationship;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDependencyRepositoryTest {

    private static Database db;
    private static JdbcDependencyRepository repo;

    @BeforeAll
    static void setup() {
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-dependencies;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcDependencyRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanEdges() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM dependencies");
            conn.commit();
        }
    }

    @Test
    void duplicateInsertIsNoOp() {
        DependencyEdge edge = new DependencyEdge("vm", "nic", DependencyKind.REQUIRED, Relationship.USES);

        assertTrue(repo.add(edge));
        assertFalse(repo.add(edge));
        assertEquals(1, repo.findAll().size());
    }

    @Test
    void selfLoopsAreNeverStored() {
        int inserted = repo.addAll(List.of(
                new DependencyEdge("vm", "VM", DependencyKind.REFERENCE, Relationship.REFERENCES),
                new DependencyEdge("vm", "disk", DependencyKind.REQUIRED, Relationship.USES)));

        assertEquals(1, inserted);
        assertEquals("disk", repo.findAll().get(0).toId());
    }

    @Test
    void findDependenciesAndDependents() {
        repo.addAll(List.of(
                new DependencyEdge("vm", "nic", DependencyKind.REQUIRED, Relationship.USES),
                new DependencyEdge("nic", "subnet", DependencyKind.REQUIRED, Relationship.USES),
                new DependencyEdge("nic", "nsg", DependencyKind.OPTIONAL, Relationship.REFERENCES)));

        List<DependencyEdge> nicDeps = repo.findDependencies("nic");
        assertEquals(2, nicDeps.size());
        assertEquals(DependencyKind.OPTIONAL, nicDeps.get(0).kind());

        List<DependencyEdge> nicDependents = repo.findDependents("nic");
        assertEquals(1, nicDependents.size());
        assertEquals("vm", nicDependents.get(0).fromId());
        assertEquals(Relationship.USES, nicDependents.get(0).relationship());
    }
}
