package stratus.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import stratus.engine.config.EngineConfig;
import stratus.engine.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool and schema for the resource state store.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off
 * so every repository method owns exactly one transaction.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("stratus-state-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("State store pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- RESOURCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS resources (
                            id                  VARCHAR(1024) PRIMARY KEY,
                            resource_type       VARCHAR(256) NOT NULL,
                            name                VARCHAR(256) NOT NULL,
                            scope               VARCHAR(256),
                            subscription_id     VARCHAR(64),
                            location            VARCHAR(64),
                            provisioning_state  VARCHAR(64),
                            managed             BOOLEAN DEFAULT FALSE,
                            properties_json     CLOB,
                            tags_json           CLOB,
                            adopted_at          TIMESTAMP,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            last_refreshed      TIMESTAMP,
                            invalidated_at      TIMESTAMP,
                            deleted_at          TIMESTAMP
                        );
                    """);

            // ---------- DEPENDENCIES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dependencies (
                            id                  BIGINT AUTO_INCREMENT PRIMARY KEY,
                            resource_id         VARCHAR(1024) NOT NULL,
                            depends_on_id       VARCHAR(1024) NOT NULL,
                            dependency_type     VARCHAR(20) NOT NULL,
                            relationship        VARCHAR(20) NOT NULL,
                            discovered_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_dependency UNIQUE (resource_id, depends_on_id, relationship),
                            CONSTRAINT ck_no_self_loop CHECK (resource_id <> depends_on_id)
                        );
                    """);

            // ---------- OPERATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS operations (
                            id                  VARCHAR(128) PRIMARY KEY,
                            operation_id        VARCHAR(128) NOT NULL,
                            capability          VARCHAR(128),
                            operation_name      VARCHAR(256),
                            mode                VARCHAR(20),
                            resource_id         VARCHAR(1024),
                            status              VARCHAR(20) DEFAULT 'PENDING',
                            started_at          TIMESTAMP,
                            completed_at        TIMESTAMP,
                            duration_seconds    BIGINT,
                            error_message       VARCHAR(4096),
                            parameters_json     CLOB,
                            parent_id           VARCHAR(128)
                        );
                    """);

            // ---------- OPERATION LOGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS operation_logs (
                            id                  BIGINT AUTO_INCREMENT PRIMARY KEY,
                            operation_id        VARCHAR(128) NOT NULL,
                            logged_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            level               VARCHAR(10) NOT NULL,
                            message             VARCHAR(4096) NOT NULL,
                            details_json        CLOB
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_resources_type ON resources(resource_type);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_resources_scope ON resources(scope);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_resources_refreshed ON resources(last_refreshed);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dependencies_from ON dependencies(resource_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dependencies_to ON dependencies(depends_on_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_operations_status ON operations(status, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_operations_def ON operations(operation_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_operation_logs_op ON operation_logs(operation_id, logged_at);");

            st.executeBatch();
            conn.commit();

            log.info("State store schema initialized");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize state store schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("State store pool closed");
        }
    }
}
