package stratus.engine.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.error.EngineException;
import stratus.engine.model.OperationCategory;
import stratus.engine.operation.RenderedCommand;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Supervises a rendered command until it finishes, fails, times out or hangs.
 * <p>
 * The supervisor for each category is looked up in a registry that must cover every
 * {@link OperationCategory}. Blocks only the calling thread.
 */
public final class OperationMonitor {

    private static final Logger log = LoggerFactory.getLogger(OperationMonitor.class);

    private final Map<OperationCategory, Supervisor> supervisors;
    private final Clock clock;
    private final Sleeper sleeper;

    public OperationMonitor(Map<OperationCategory, Supervisor> supervisors, Clock clock, Sleeper sleeper) {
        EnumMap<OperationCategory, Supervisor> registry = new EnumMap<>(OperationCategory.class);
        registry.putAll(supervisors);
        for (OperationCategory category : OperationCategory.values()) {
            if (registry.get(category) == null) {
                throw new IllegalArgumentException("No supervisor registered for category " + category);
            }
        }
        this.supervisors = registry;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Run and supervise one command.
     *
     * @param command           rendered command
     * @param runId             operation record id
     * @param validationEnabled whether a missing [SUCCESS] marker is suspicious
     * @return the successful result
     * @throws stratus.engine.error.OperationExecutionException on nonzero exit or [ERROR]
     * @throws stratus.engine.error.OperationTimeoutException   after cancelling overdue work
     * @throws stratus.engine.error.StaleHeartbeatException     when remote work appears hung
     */
    public MonitorResult supervise(RenderedCommand command, String runId, boolean validationEnabled) {
        Supervisor supervisor = supervisors.get(command.category());
        Duration interval = supervisor.pollInterval(command);
        log.debug("Supervising {} as {} every {}ms", command.operationId(), command.category(), interval.toMillis());

        Supervision supervision = supervisor.start(command, runId, validationEnabled);
        while (true) {
            Optional<MonitorResult> result = supervision.tick(clock.instant());
            if (result.isPresent()) {
                return result.get();
            }
            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                supervision.cancel();
                throw new EngineException("Supervision of " + command.operationId() + " interrupted", e);
            }
        }
    }
}
