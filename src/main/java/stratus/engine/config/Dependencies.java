package stratus.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.client.CloudControlPlaneClient;
import stratus.engine.client.CommandLines;
import stratus.engine.client.ProcessControlPlaneClient;
import stratus.engine.graph.DependencyDetector;
import stratus.engine.graph.DependencyGraphBuilder;
import stratus.engine.model.OperationCategory;
import stratus.engine.monitor.CheckpointStore;
import stratus.engine.monitor.HeartbeatSupervisor;
import stratus.engine.monitor.OperationMonitor;
import stratus.engine.monitor.ProcessSupervisor;
import stratus.engine.monitor.Sleeper;
import stratus.engine.monitor.Supervisor;
import stratus.engine.operation.DefinitionValidator;
import stratus.engine.operation.DiscoveredValueResolver;
import stratus.engine.operation.IdempotencyChecker;
import stratus.engine.operation.OperationCatalog;
import stratus.engine.operation.OperationDefinitionParser;
import stratus.engine.operation.ParameterResolver;
import stratus.engine.operation.TemplateRenderer;
import stratus.engine.repository.DependencyRepository;
import stratus.engine.repository.OperationRepository;
import stratus.engine.repository.ResourceRepository;
import stratus.engine.scheduler.Scheduler;
import stratus.engine.scheduler.StaleOperationReaper;
import stratus.engine.service.DiscoveryService;
import stratus.engine.service.MetricsService;
import stratus.engine.service.OperationPipeline;
import stratus.engine.service.PostCheckRunner;
import stratus.engine.service.PrerequisiteChecker;
import stratus.engine.service.ResourceStateService;
import stratus.engine.service.RollbackRunner;
import stratus.engine.store.Database;
import stratus.engine.store.JdbcDependencyRepository;
import stratus.engine.store.JdbcMetricsRepository;
import stratus.engine.store.JdbcOperationRepository;
import stratus.engine.store.JdbcResourceRepository;
import stratus.engine.store.StorageRetry;
import stratus.engine.workflow.ExecutionStore;
import stratus.engine.workflow.OperationLocator;
import stratus.engine.workflow.WorkflowOrchestrator;
import stratus.engine.workflow.WorkflowParser;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components from one {@link EngineConfig}.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.startScheduler(); // optional background maintenance
 * WorkflowOrchestrator orchestrator = deps.workflowOrchestrator();
 * // ... run workflows ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Clock clock;
    private final Database database;
    private final StorageRetry storageRetry;
    private final ConfigProvider configProvider;
    private final CloudControlPlaneClient client;

    // Repositories
    private final ResourceRepository resourceRepository;
    private final DependencyRepository dependencyRepository;
    private final OperationRepository operationRepository;

    // Components
    private final ResourceStateService resourceStateService;
    private final DependencyGraphBuilder graphBuilder;
    private final OperationCatalog operationCatalog;
    private final OperationDefinitionParser definitionParser;
    private final DefinitionValidator definitionValidator;
    private final TemplateRenderer templateRenderer;
    private final CheckpointStore checkpointStore;
    private final OperationMonitor operationMonitor;
    private final OperationPipeline operationPipeline;
    private final DiscoveryService discoveryService;
    private final MetricsService metricsService;
    private final WorkflowOrchestrator workflowOrchestrator;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(EngineConfig config, CloudControlPlaneClient client, ConfigProvider configProvider,
                         Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.storageRetry = new StorageRetry(config.storageRetryAttempts(), config.storageRetryBackoff());
        this.configProvider = configProvider != null ? configProvider
                : IniConfigProvider.load(config.deploymentConfigFile());
        this.client = client != null ? client
                : new ProcessControlPlaneClient(config.controlPlaneExecutable(), config.projectRoot(),
                        config.controlPlaneCommandTimeout(), clock);

        // Repositories
        this.resourceRepository = new JdbcResourceRepository(database, config.resourceCacheTtl(), clock);
        this.dependencyRepository = new JdbcDependencyRepository(database);
        this.operationRepository = new JdbcOperationRepository(database);

        // State and graph
        this.resourceStateService = new ResourceStateService(resourceRepository, storageRetry);
        this.graphBuilder = new DependencyGraphBuilder(resourceRepository, dependencyRepository,
                new DependencyDetector(), storageRetry);

        // Operation resolution
        this.definitionParser = new OperationDefinitionParser();
        this.operationCatalog = new OperationCatalog(config.capabilitiesDir(), definitionParser);
        this.definitionValidator = new DefinitionValidator(operationCatalog);
        this.templateRenderer = new TemplateRenderer(this.configProvider,
                new DiscoveredValueResolver(resourceRepository, this.configProvider));

        // Monitor
        this.checkpointStore = new CheckpointStore(config.checkpointsDir());
        ProcessSupervisor fast = new ProcessSupervisor(new CommandLines(config.controlPlaneExecutable()),
                config.projectRoot(), config.logsDir(), clock, config.markerPollInterval(),
                config.fastProgressInterval());
        ProcessSupervisor wait = new ProcessSupervisor(new CommandLines(config.controlPlaneExecutable()),
                config.projectRoot(), config.logsDir(), clock, config.markerPollInterval(),
                config.waitProgressInterval());
        Map<OperationCategory, Supervisor> supervisors = new EnumMap<>(OperationCategory.class);
        supervisors.put(OperationCategory.FAST, fast);
        supervisors.put(OperationCategory.WAIT, wait);
        supervisors.put(OperationCategory.HEARTBEAT, new HeartbeatSupervisor(this.client, clock,
                config.heartbeatPollInterval(), config.heartbeatStaleThreshold()));
        this.operationMonitor = new OperationMonitor(supervisors, clock, sleeper);

        // Services
        this.operationPipeline = new OperationPipeline(operationCatalog, definitionValidator,
                new ParameterResolver(this.configProvider),
                new PrerequisiteChecker(checkpointStore),
                new IdempotencyChecker(this.client, templateRenderer),
                templateRenderer, operationMonitor,
                new PostCheckRunner(this.client, templateRenderer),
                new RollbackRunner(this.client, templateRenderer),
                checkpointStore, operationRepository, resourceStateService, storageRetry, clock);
        this.discoveryService = new DiscoveryService(this.client, resourceStateService, graphBuilder);
        this.metricsService = new MetricsService(new JdbcMetricsRepository(database), storageRetry, clock);

        // Workflows
        this.workflowOrchestrator = new WorkflowOrchestrator(new WorkflowParser(),
                new OperationLocator(config.projectRoot(), config.workflowsDir(), operationCatalog, definitionParser),
                operationPipeline, new ExecutionStore(config.executionsDir()), clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, the CLI-backed control-plane client and
     * the deployment INI file.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, null, null, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * Create dependencies with an explicit control-plane client and config provider.
     */
    public static Dependencies create(EngineConfig config, CloudControlPlaneClient client,
                                      ConfigProvider configProvider) {
        return new Dependencies(config, client, configProvider, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public ConfigProvider configProvider() {
        return configProvider;
    }

    public CloudControlPlaneClient client() {
        return client;
    }

    public ResourceRepository resourceRepository() {
        return resourceRepository;
    }

    public DependencyRepository dependencyRepository() {
        return dependencyRepository;
    }

    public OperationRepository operationRepository() {
        return operationRepository;
    }

    public ResourceStateService resourceStateService() {
        return resourceStateService;
    }

    public DependencyGraphBuilder graphBuilder() {
        return graphBuilder;
    }

    public OperationCatalog operationCatalog() {
        return operationCatalog;
    }

    public DefinitionValidator definitionValidator() {
        return definitionValidator;
    }

    public CheckpointStore checkpointStore() {
        return checkpointStore;
    }

    public OperationMonitor operationMonitor() {
        return operationMonitor;
    }

    public OperationPipeline operationPipeline() {
        return operationPipeline;
    }

    public DiscoveryService discoveryService() {
        return discoveryService;
    }

    public MetricsService metricsService() {
        return metricsService;
    }

    public WorkflowOrchestrator workflowOrchestrator() {
        return workflowOrchestrator;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            StaleOperationReaper reaper = new StaleOperationReaper(operationRepository, checkpointStore,
                    config.abandonedOperationThreshold(), clock);
            scheduler = new Scheduler(reaper, discoveryService::refreshStale, config.reaperInterval(),
                    config.resourceRefreshInterval());
        }
        return scheduler;
    }

    /**
     * Start background maintenance: operation reaping and stale resource refresh.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            workflowOrchestrator.close();
        } catch (Exception e) {
            log.warn("Error stopping workflow runners: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
