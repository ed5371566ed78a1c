package stratus.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import stratus.engine.error.StorageException;
import stratus.engine.model.Resource;
import stratus.engine.model.ResourceFilter;
import stratus.engine.model.ResourceView;
import stratus.engine.repository.ResourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static stratus.engine.store.JdbcSupport.globToLike;
import static stratus.engine.store.JdbcSupport.setTimestamp;
import static stratus.engine.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of ResourceRepository.
 * Freshness is derived from {@code last_refreshed} against the configured cache TTL.
 */
public class JdbcResourceRepository implements ResourceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcResourceRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> TAGS_TYPE = new TypeReference<>() {
    };

    private final Database db;
    private final Duration cacheTtl;
    private final Clock clock;

    public JdbcResourceRepository(Database db, Duration cacheTtl) {
        this(db, cacheTtl, Clock.systemUTC());
    }

    public JdbcResourceRepository(Database db, Duration cacheTtl, Clock clock) {
        this.db = db;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    @Override
    public void store(Resource resource) {
        storeAll(List.of(resource));
    }

    @Override
    public void storeAll(List<Resource> resources) {
        if (resources.isEmpty())
            return;

        String updateSql = """
                    UPDATE resources
                    SET resource_type = ?, name = ?, scope = ?, subscription_id = ?, location = ?,
                        provisioning_state = ?, managed = ?, properties_json = ?, tags_json = ?,
                        adopted_at = COALESCE(?, adopted_at), last_refreshed = ?,
                        invalidated_at = NULL, deleted_at = NULL
                    WHERE id = ?
                """;
        String insertSql = """
                    INSERT INTO resources (resource_type, name, scope, subscription_id, location,
                                           provisioning_state, managed, properties_json, tags_json,
                                           adopted_at, last_refreshed, id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = clock.instant();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement update = conn.prepareStatement(updateSql);
                    PreparedStatement insert = conn.prepareStatement(insertSql)) {

                int inserted = 0;
                for (Resource resource : resources) {
                    bindUpsert(update, resource, now);
                    if (update.executeUpdate() == 0) {
                        bindUpsert(insert, resource, now);
                        setTimestamp(insert, 13, resource.createdAt() != null ? resource.createdAt() : now);
                        insert.executeUpdate();
                        inserted++;
                    }
                }

                conn.commit();
                log.debug("Stored {} resources ({} new)", resources.size(), inserted);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store resources: " + describe(resources), e);
        }
    }

    @Override
    public Optional<Resource> findById(String id) {
        String sql = "SELECT * FROM resources WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            List<Resource> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StorageException("Failed to find resource: " + id, e);
        }
    }

    @Override
    public List<ResourceView> query(ResourceFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM resources WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (!filter.includeDeleted()) {
            sql.append(" AND deleted_at IS NULL");
        }
        if (filter.type() != null) {
            sql.append(" AND LOWER(resource_type) = LOWER(?)");
            args.add(filter.type());
        }
        if (filter.scope() != null) {
            sql.append(" AND LOWER(scope) = LOWER(?)");
            args.add(filter.scope());
        }
        if (filter.name() != null) {
            sql.append(" AND name = ?");
            args.add(filter.name());
        }
        if (filter.managed() != null) {
            sql.append(" AND managed = ?");
            args.add(filter.managed());
        }
        sql.append(" ORDER BY resource_type, name");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }

            Instant now = clock.instant();
            List<ResourceView> views = new ArrayList<>();
            for (Resource resource : executeQuery(ps)) {
                views.add(new ResourceView(resource, resource.isFresh(now, cacheTtl)));
            }
            return views;
        } catch (SQLException e) {
            throw new StorageException("Failed to query resources: " + filter, e);
        }
    }

    @Override
    public int invalidate(String pattern) {
        String sql = """
                    UPDATE resources SET invalidated_at = ?
                    WHERE deleted_at IS NULL
                      AND (LOWER(id) LIKE LOWER(?) OR LOWER(resource_type) LIKE LOWER(?))
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            String like = globToLike(pattern);
            setTimestamp(ps, 1, clock.instant());
            ps.setString(2, like);
            ps.setString(3, like);
            int updated = ps.executeUpdate();
            conn.commit();

            log.info("Invalidated {} resources matching '{}'", updated, pattern);
            return updated;
        } catch (SQLException e) {
            throw new StorageException("Failed to invalidate resources: " + pattern, e);
        }
    }

    @Override
    public boolean markDeleted(String id) {
        String sql = "UPDATE resources SET deleted_at = ? WHERE id = ? AND deleted_at IS NULL";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, clock.instant());
            ps.setString(2, id);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete resource: " + id, e);
        }
    }

    @Override
    public List<Resource> findStale(int limit) {
        String sql = """
                    SELECT * FROM resources
                    WHERE deleted_at IS NULL
                      AND (invalidated_at IS NOT NULL OR last_refreshed IS NULL OR last_refreshed <= ?)
                    ORDER BY last_refreshed
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, clock.instant().minus(cacheTtl));
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to find stale resources", e);
        }
    }

    // ==================== Helpers ====================

    private void bindUpsert(PreparedStatement ps, Resource r, Instant now) throws SQLException {
        ps.setString(1, r.type());
        ps.setString(2, r.name());
        ps.setString(3, r.scope());
        ps.setString(4, r.subscriptionId());
        ps.setString(5, r.location());
        ps.setString(6, r.provisioningState());
        ps.setBoolean(7, r.managed());
        ps.setString(8, r.properties());
        ps.setString(9, writeTags(r.tags()));
        setTimestamp(ps, 10, r.adoptedAt());
        setTimestamp(ps, 11, now);
        ps.setString(12, r.id());
    }

    private List<Resource> executeQuery(PreparedStatement ps) throws SQLException {
        List<Resource> resources = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                resources.add(mapRow(rs));
            }
        }
        return resources;
    }

    private Resource mapRow(ResultSet rs) throws SQLException {
        return Resource.builder()
                .id(rs.getString("id"))
                .type(rs.getString("resource_type"))
                .name(rs.getString("name"))
                .scope(rs.getString("scope"))
                .subscriptionId(rs.getString("subscription_id"))
                .location(rs.getString("location"))
                .provisioningState(rs.getString("provisioning_state"))
                .managed(rs.getBoolean("managed"))
                .properties(rs.getString("properties_json"))
                .tags(readTags(rs.getString("tags_json")))
                .adoptedAt(toInstant(rs.getTimestamp("adopted_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .lastRefreshed(toInstant(rs.getTimestamp("last_refreshed")))
                .invalidatedAt(toInstant(rs.getTimestamp("invalidated_at")))
                .deletedAt(toInstant(rs.getTimestamp("deleted_at")))
                .build();
    }

    private static String writeTags(Map<String, String> tags) {
        try {
            return MAPPER.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tags are not serializable", e);
        }
    }

    private static Map<String, String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, TAGS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable tags: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static String describe(List<Resource> resources) {
        return resources.size() == 1 ? resources.get(0).id() : resources.size() + " resources";
    }
}
