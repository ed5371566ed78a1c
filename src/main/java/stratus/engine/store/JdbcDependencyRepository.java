package stratus.engine.store;

import stratus.engine.error.StorageException;
import stratus.engine.model.DependencyEdge;
import stratus.engine.model.DependencyKind;
import stratus.engine.model.Relationship;
import stratus.engine.repository.DependencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of DependencyRepository.
 * Uses insert-if-absent so re-running detection never duplicates edges.
 */
public class JdbcDependencyRepository implements DependencyRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDependencyRepository.class);

    private static final String EXISTS = """
                SELECT 1 FROM dependencies
                WHERE resource_id = ? AND depends_on_id = ? AND relationship = ?
            """;

    private static final String INSERT = """
                INSERT INTO dependencies (resource_id, depends_on_id, dependency_type, relationship, discovered_at)
                VALUES (?, ?, ?, ?, ?)
            """;

    private final Database db;

    public JdbcDependencyRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean add(DependencyEdge edge) {
        return addAll(List.of(edge)) > 0;
    }

    @Override
    public int addAll(List<DependencyEdge> edges) {
        if (edges.isEmpty())
            return 0;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement exists = conn.prepareStatement(EXISTS);
                    PreparedStatement insert = conn.prepareStatement(INSERT)) {
                Timestamp now = Timestamp.from(Instant.now());
                int inserted = 0;

                for (DependencyEdge edge : edges) {
                    if (edge.isSelfLoop()) {
                        log.debug("Skipping self-loop on {}", edge.fromId());
                        continue;
                    }
                    exists.setString(1, edge.fromId());
                    exists.setString(2, edge.toId());
                    exists.setString(3, edge.relationship().name());
                    try (ResultSet rs = exists.executeQuery()) {
                        if (rs.next()) {
                            continue;
                        }
                    }
                    insert.setString(1, edge.fromId());
                    insert.setString(2, edge.toId());
                    insert.setString(3, edge.kind().name());
                    insert.setString(4, edge.relationship().name());
                    insert.setTimestamp(5, now);
                    inserted += insert.executeUpdate();
                }

                conn.commit();
                return inserted;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to insert " + edges.size() + " dependency edges", e);
        }
    }

    @Override
    public List<DependencyEdge> findAll() {
        String sql = "SELECT * FROM dependencies ORDER BY resource_id, depends_on_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to list dependencies", e);
        }
    }

    @Override
    public List<DependencyEdge> findDependencies(String resourceId) {
        return findBy("resource_id", resourceId);
    }

    @Override
    public List<DependencyEdge> findDependents(String resourceId) {
        return findBy("depends_on_id", resourceId);
    }

    private List<DependencyEdge> findBy(String column, String resourceId) {
        String sql = "SELECT * FROM dependencies WHERE " + column + " = ? ORDER BY dependency_type, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, resourceId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to find dependencies for: " + resourceId, e);
        }
    }

    private List<DependencyEdge> executeQuery(PreparedStatement ps) throws SQLException {
        List<DependencyEdge> edges = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                edges.add(new DependencyEdge(
                        rs.getString("resource_id"),
                        rs.getString("depends_on_id"),
                        DependencyKind.valueOf(rs.getString("dependency_type")),
                        Relationship.valueOf(rs.getString("relationship"))));
            }
        }
        return edges;
    }
}
