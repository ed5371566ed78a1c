package stratus.engine.store;

import stratus.engine.error.StorageException;
import stratus.engine.model.LogLevel;
import stratus.engine.model.OperationLogEntry;
import stratus.engine.model.OperationRecord;
import stratus.engine.model.OperationStatus;
import stratus.engine.repository.OperationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static stratus.engine.store.JdbcSupport.getLongOrNull;
import static stratus.engine.store.JdbcSupport.setTimestamp;
import static stratus.engine.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of OperationRepository.
 */
public class JdbcOperationRepository implements OperationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOperationRepository.class);
    private static final int MAX_MESSAGE = 4000;

    private final Database db;

    public JdbcOperationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void create(OperationRecord record) {
        String sql = """
                    INSERT INTO operations (id, operation_id, capability, operation_name, mode, resource_id,
                                            status, started_at, completed_at, duration_seconds, error_message,
                                            parameters_json, parent_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.id());
            ps.setString(2, record.operationId());
            ps.setString(3, record.capability());
            ps.setString(4, record.operationName());
            ps.setString(5, record.mode());
            ps.setString(6, record.resourceId());
            ps.setString(7, record.status().name());
            setTimestamp(ps, 8, record.startedAt());
            setTimestamp(ps, 9, record.completedAt());
            JdbcSupport.setLongOrNull(ps, 10, record.durationSeconds());
            ps.setString(11, truncate(record.errorMessage()));
            ps.setString(12, record.parameters());
            ps.setString(13, record.parentId());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to create operation: " + record.id(), e);
        }
    }

    @Override
    public boolean markRunning(String id, Instant startedAt) {
        String sql = "UPDATE operations SET status = 'RUNNING', started_at = ? WHERE id = ? AND status = 'PENDING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, startedAt);
            ps.setString(2, id);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to mark operation running: " + id, e);
        }
    }

    @Override
    public boolean complete(String id, OperationStatus status, Instant completedAt, long durationSeconds,
            String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }

        String sql = """
                    UPDATE operations
                    SET status = ?, completed_at = ?, duration_seconds = ?, error_message = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            setTimestamp(ps, 2, completedAt);
            ps.setLong(3, durationSeconds);
            ps.setString(4, truncate(errorMessage));
            ps.setString(5, id);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Operation {} finalized as {}", id, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to complete operation: " + id, e);
        }
    }

    @Override
    public boolean failIfRunning(String id, String errorMessage) {
        String sql = """
                    UPDATE operations
                    SET status = 'FAILED', completed_at = ?, error_message = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, Instant.now());
            ps.setString(2, truncate(errorMessage));
            ps.setString(3, id);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to fail operation: " + id, e);
        }
    }

    @Override
    public Optional<OperationRecord> findById(String id) {
        String sql = "SELECT * FROM operations WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            List<OperationRecord> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StorageException("Failed to find operation: " + id, e);
        }
    }

    @Override
    public Optional<OperationRecord> findLatestByOperationId(String operationId) {
        String sql = """
                    SELECT * FROM operations WHERE operation_id = ?
                    ORDER BY started_at DESC NULLS LAST, id DESC
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, operationId);
            List<OperationRecord> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StorageException("Failed to find latest operation for: " + operationId, e);
        }
    }

    @Override
    public List<OperationRecord> findByStatus(OperationStatus status, int limit) {
        String sql = "SELECT * FROM operations WHERE status = ? ORDER BY started_at DESC NULLS LAST LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to find operations by status: " + status, e);
        }
    }

    @Override
    public List<OperationRecord> findRunningStartedBefore(Instant startedBefore) {
        String sql = "SELECT * FROM operations WHERE status = 'RUNNING' AND started_at < ? ORDER BY started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, startedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to find running operations", e);
        }
    }

    @Override
    public List<OperationRecord> findRecent(int limit) {
        String sql = "SELECT * FROM operations ORDER BY started_at DESC NULLS LAST, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to list recent operations", e);
        }
    }

    @Override
    public void appendLog(OperationLogEntry entry) {
        String sql = """
                    INSERT INTO operation_logs (operation_id, logged_at, level, message, details_json)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.operationId());
            setTimestamp(ps, 2, entry.loggedAt() != null ? entry.loggedAt() : Instant.now());
            ps.setString(3, entry.level().name());
            ps.setString(4, truncate(entry.message()));
            ps.setString(5, entry.details());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to append log for operation: " + entry.operationId(), e);
        }
    }

    @Override
    public List<OperationLogEntry> findLogs(String operationId) {
        String sql = "SELECT * FROM operation_logs WHERE operation_id = ? ORDER BY logged_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, operationId);
            List<OperationLogEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new OperationLogEntry(
                            rs.getString("operation_id"),
                            toInstant(rs.getTimestamp("logged_at")),
                            LogLevel.valueOf(rs.getString("level")),
                            rs.getString("message"),
                            rs.getString("details_json")));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new StorageException("Failed to read logs for operation: " + operationId, e);
        }
    }

    // ==================== Helpers ====================

    private List<OperationRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<OperationRecord> records = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                records.add(mapRow(rs));
            }
        }
        return records;
    }

    private OperationRecord mapRow(ResultSet rs) throws SQLException {
        return OperationRecord.builder()
                .id(rs.getString("id"))
                .operationId(rs.getString("operation_id"))
                .capability(rs.getString("capability"))
                .operationName(rs.getString("operation_name"))
                .mode(rs.getString("mode"))
                .resourceId(rs.getString("resource_id"))
                .status(OperationStatus.valueOf(rs.getString("status")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .durationSeconds(getLongOrNull(rs, "duration_seconds"))
                .errorMessage(rs.getString("error_message"))
                .parameters(rs.getString("parameters_json"))
                .parentId(rs.getString("parent_id"))
                .build();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE);
    }
}
