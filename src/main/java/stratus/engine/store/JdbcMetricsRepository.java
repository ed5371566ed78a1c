package stratus.engine.store;

import stratus.engine.error.StorageException;
import stratus.engine.model.DailyFailures;
import stratus.engine.model.OperationStats;
import stratus.engine.model.OperationStatus;
import stratus.engine.model.OperationTiming;
import stratus.engine.repository.MetricsRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static stratus.engine.store.JdbcSupport.getLongOrNull;
import static stratus.engine.store.JdbcSupport.setTimestamp;
import static stratus.engine.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of MetricsRepository over the operations table.
 */
public class JdbcMetricsRepository implements MetricsRepository {

    private static final String SETTLED = "status IN ('COMPLETED', 'FAILED')";

    private static final String AGGREGATES = """
                COUNT(*) AS total,
                COUNT(CASE WHEN status = 'COMPLETED' THEN 1 END) AS succeeded,
                COUNT(CASE WHEN status = 'FAILED' THEN 1 END) AS failed,
                AVG(CAST(duration_seconds AS DOUBLE PRECISION)) AS avg_seconds,
                MIN(duration_seconds) AS min_seconds,
                MAX(duration_seconds) AS max_seconds
            """;

    private final Database db;

    public JdbcMetricsRepository(Database db) {
        this.db = db;
    }

    @Override
    public OperationStats overall(String capability) {
        String sql = "SELECT NULL AS group_key, " + AGGREGATES + " FROM operations WHERE " + SETTLED
                + (capability != null ? " AND capability = ?" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (capability != null) {
                ps.setString(1, capability);
            }
            List<OperationStats> rows = executeStats(ps);
            return rows.isEmpty() ? new OperationStats(null, 0, 0, 0, null, null, null) : rows.get(0);
        } catch (SQLException e) {
            throw new StorageException("Failed to compute operation totals", e);
        }
    }

    @Override
    public List<OperationStats> byCapability() {
        return grouped("capability", "avg_seconds DESC NULLS LAST, group_key", null);
    }

    @Override
    public List<OperationStats> byMode() {
        return grouped("mode", "avg_seconds DESC NULLS LAST, group_key", null);
    }

    @Override
    public List<OperationStats> byOperation(String capability) {
        return grouped("operation_id", "total DESC, group_key", capability);
    }

    @Override
    public List<OperationStats> mostFailing(int limit) {
        String sql = "SELECT operation_id AS group_key, " + AGGREGATES + " FROM operations WHERE " + SETTLED
                + " GROUP BY operation_id HAVING COUNT(CASE WHEN status = 'FAILED' THEN 1 END) > 0"
                + " ORDER BY failed DESC, group_key LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeStats(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to list failing operations", e);
        }
    }

    @Override
    public List<OperationTiming> slowest(int limit) {
        String sql = """
                    SELECT id, operation_id, capability, mode, status, duration_seconds, completed_at
                    FROM operations
                    WHERE status IN ('COMPLETED', 'FAILED') AND duration_seconds IS NOT NULL
                    ORDER BY duration_seconds DESC, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<OperationTiming> timings = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    timings.add(new OperationTiming(
                            rs.getString("id"),
                            rs.getString("operation_id"),
                            rs.getString("capability"),
                            rs.getString("mode"),
                            OperationStatus.valueOf(rs.getString("status")),
                            rs.getLong("duration_seconds"),
                            toInstant(rs.getTimestamp("completed_at"))));
                }
            }
            return timings;
        } catch (SQLException e) {
            throw new StorageException("Failed to list slowest operations", e);
        }
    }

    @Override
    public List<DailyFailures> failureTrend(Instant since) {
        String sql = """
                    SELECT CAST(completed_at AS DATE) AS run_day,
                           COUNT(*) AS total,
                           COUNT(CASE WHEN status = 'FAILED' THEN 1 END) AS failed
                    FROM operations
                    WHERE status IN ('COMPLETED', 'FAILED') AND completed_at >= ?
                    GROUP BY CAST(completed_at AS DATE)
                    ORDER BY run_day DESC
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, since);
            List<DailyFailures> days = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    days.add(new DailyFailures(rs.getDate("run_day").toLocalDate(), rs.getLong("total"),
                            rs.getLong("failed")));
                }
            }
            return days;
        } catch (SQLException e) {
            throw new StorageException("Failed to compute failure trend since " + since, e);
        }
    }

    @Override
    public List<Long> durations(String capability) {
        String sql = "SELECT duration_seconds FROM operations WHERE " + SETTLED
                + " AND duration_seconds IS NOT NULL"
                + (capability != null ? " AND capability = ?" : "")
                + " ORDER BY duration_seconds";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (capability != null) {
                ps.setString(1, capability);
            }
            List<Long> durations = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    durations.add(rs.getLong(1));
                }
            }
            return durations;
        } catch (SQLException e) {
            throw new StorageException("Failed to read operation durations", e);
        }
    }

    private List<OperationStats> grouped(String column, String orderBy, String capability) {
        String sql = "SELECT " + column + " AS group_key, " + AGGREGATES + " FROM operations WHERE " + SETTLED
                + (capability != null ? " AND capability = ?" : "")
                + " GROUP BY " + column + " ORDER BY " + orderBy;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (capability != null) {
                ps.setString(1, capability);
            }
            return executeStats(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to group operations by " + column, e);
        }
    }

    private List<OperationStats> executeStats(PreparedStatement ps) throws SQLException {
        List<OperationStats> rows = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                double avg = rs.getDouble("avg_seconds");
                Double avgSeconds = rs.wasNull() ? null : avg;
                rows.add(new OperationStats(
                        rs.getString("group_key"),
                        rs.getLong("total"),
                        rs.getLong("succeeded"),
                        rs.getLong("failed"),
                        avgSeconds,
                        getLongOrNull(rs, "min_seconds"),
                        getLongOrNull(rs, "max_seconds")));
            }
        }
        return rows;
    }
}
