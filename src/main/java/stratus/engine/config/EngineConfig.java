package stratus.engine.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./state/stratus;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private int storageRetryAttempts = 3;
    private Duration storageRetryBackoff = Duration.ofMillis(200);

    // Resource cache
    private Duration resourceCacheTtl = Duration.ofHours(24);

    // Layout
    private Path projectRoot = Path.of(".");
    private Path capabilitiesDir = Path.of("capabilities");
    private Path workflowsDir = Path.of("workflows");
    private Path stateDir = Path.of("state");
    private Path logsDir = Path.of("logs");
    private Path deploymentConfigFile = Path.of("config", "deployment.ini");

    // Monitor settings
    private Duration markerPollInterval = Duration.ofSeconds(2);
    private Duration fastProgressInterval = Duration.ofSeconds(10);
    private Duration waitProgressInterval = Duration.ofSeconds(60);
    private Duration heartbeatPollInterval = Duration.ofSeconds(60);
    private Duration heartbeatStaleThreshold = Duration.ofMinutes(10);

    // Maintenance
    private Duration abandonedOperationThreshold = Duration.ofHours(6);
    private Duration reaperInterval = Duration.ofMinutes(5);
    private Duration resourceRefreshInterval = Duration.ofHours(1);

    // Collaborator
    private String controlPlaneExecutable = "az";
    private Duration controlPlaneCommandTimeout = Duration.ofMinutes(5);

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        // Override from environment variables
        String dbUrl = System.getenv("STRATUS_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String root = System.getenv("STRATUS_PROJECT_ROOT");
        if (root != null && !root.isBlank()) {
            config.projectRoot = Path.of(root);
        }

        String capabilities = System.getenv("STRATUS_CAPABILITIES_DIR");
        if (capabilities != null && !capabilities.isBlank()) {
            config.capabilitiesDir = Path.of(capabilities);
        }

        String workflows = System.getenv("STRATUS_WORKFLOWS_DIR");
        if (workflows != null && !workflows.isBlank()) {
            config.workflowsDir = Path.of(workflows);
        }

        String state = System.getenv("STRATUS_STATE_DIR");
        if (state != null && !state.isBlank()) {
            config.stateDir = Path.of(state);
        }

        String deploymentConfig = System.getenv("STRATUS_CONFIG_FILE");
        if (deploymentConfig != null && !deploymentConfig.isBlank()) {
            config.deploymentConfigFile = Path.of(deploymentConfig);
        }

        String ttlHours = System.getenv("STRATUS_CACHE_TTL_HOURS");
        if (ttlHours != null && !ttlHours.isBlank()) {
            config.resourceCacheTtl = Duration.ofHours(Long.parseLong(ttlHours));
        }

        String cli = System.getenv("STRATUS_CLI");
        if (cli != null && !cli.isBlank()) {
            config.controlPlaneExecutable = cli;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int storageRetryAttempts() {
        return storageRetryAttempts;
    }

    public Duration storageRetryBackoff() {
        return storageRetryBackoff;
    }

    public Duration resourceCacheTtl() {
        return resourceCacheTtl;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    /** Capabilities directory, resolved against the project root when relative. */
    public Path capabilitiesDir() {
        return projectRoot.resolve(capabilitiesDir);
    }

    public Path workflowsDir() {
        return projectRoot.resolve(workflowsDir);
    }

    public Path stateDir() {
        return projectRoot.resolve(stateDir);
    }

    public Path checkpointsDir() {
        return stateDir().resolve("checkpoints");
    }

    public Path executionsDir() {
        return stateDir().resolve("executions");
    }

    public Path logsDir() {
        return projectRoot.resolve(logsDir);
    }

    public Path deploymentConfigFile() {
        return projectRoot.resolve(deploymentConfigFile);
    }

    public Duration markerPollInterval() {
        return markerPollInterval;
    }

    public Duration fastProgressInterval() {
        return fastProgressInterval;
    }

    public Duration waitProgressInterval() {
        return waitProgressInterval;
    }

    public Duration heartbeatPollInterval() {
        return heartbeatPollInterval;
    }

    public Duration heartbeatStaleThreshold() {
        return heartbeatStaleThreshold;
    }

    public Duration abandonedOperationThreshold() {
        return abandonedOperationThreshold;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration resourceRefreshInterval() {
        return resourceRefreshInterval;
    }

    public String controlPlaneExecutable() {
        return controlPlaneExecutable;
    }

    public Duration controlPlaneCommandTimeout() {
        return controlPlaneCommandTimeout;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withStorageRetry(int attempts, Duration backoff) {
        this.storageRetryAttempts = attempts;
        this.storageRetryBackoff = backoff;
        return this;
    }

    public EngineConfig withResourceCacheTtl(Duration ttl) {
        this.resourceCacheTtl = ttl;
        return this;
    }

    public EngineConfig withProjectRoot(Path root) {
        this.projectRoot = root;
        return this;
    }

    public EngineConfig withCapabilitiesDir(Path dir) {
        this.capabilitiesDir = dir;
        return this;
    }

    public EngineConfig withWorkflowsDir(Path dir) {
        this.workflowsDir = dir;
        return this;
    }

    public EngineConfig withStateDir(Path dir) {
        this.stateDir = dir;
        return this;
    }

    public EngineConfig withLogsDir(Path dir) {
        this.logsDir = dir;
        return this;
    }

    public EngineConfig withDeploymentConfigFile(Path file) {
        this.deploymentConfigFile = file;
        return this;
    }

    public EngineConfig withMarkerPollInterval(Duration interval) {
        this.markerPollInterval = interval;
        return this;
    }

    public EngineConfig withHeartbeat(Duration pollInterval, Duration staleThreshold) {
        this.heartbeatPollInterval = pollInterval;
        this.heartbeatStaleThreshold = staleThreshold;
        return this;
    }

    public EngineConfig withAbandonedOperationThreshold(Duration threshold) {
        this.abandonedOperationThreshold = threshold;
        return this;
    }

    public EngineConfig withMaintenance(Duration reaperInterval, Duration resourceRefreshInterval) {
        this.reaperInterval = reaperInterval;
        this.resourceRefreshInterval = resourceRefreshInterval;
        return this;
    }

    public EngineConfig withControlPlaneExecutable(String executable) {
        this.controlPlaneExecutable = executable;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", projectRoot=" + projectRoot +
                ", cacheTtl=" + resourceCacheTtl +
                ", cli='" + controlPlaneExecutable + '\'' +
                '}';
    }
}
