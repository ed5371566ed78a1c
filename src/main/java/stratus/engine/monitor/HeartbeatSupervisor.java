package stratus.engine.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.client.CloudControlPlaneClient;
import stratus.engine.client.RemoteExecutionState;
import stratus.engine.client.RemoteHandle;
import stratus.engine.client.RemoteStatus;
import stratus.engine.error.OperationExecutionException;
import stratus.engine.error.OperationTimeoutException;
import stratus.engine.error.StaleHeartbeatException;
import stratus.engine.operation.RenderedCommand;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Supervises very long remote work dispatched asynchronously.
 * <p>
 * Two signals are polled independently: the dispatcher's execution state and the heartbeat
 * artifact the remote process refreshes. Running with a stale heartbeat means hung.
 */
public final class HeartbeatSupervisor implements Supervisor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatSupervisor.class);

    private final CloudControlPlaneClient client;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration defaultStaleThreshold;

    public HeartbeatSupervisor(CloudControlPlaneClient client, Clock clock,
                               Duration pollInterval, Duration defaultStaleThreshold) {
        this.client = client;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.defaultStaleThreshold = defaultStaleThreshold;
    }

    @Override
    public Duration pollInterval(RenderedCommand command) {
        return pollInterval;
    }

    @Override
    public Supervision start(RenderedCommand command, String runId, boolean validationEnabled) {
        RemoteHandle handle = client.dispatch(command);
        Instant startedAt = handle.dispatchedAt() != null ? handle.dispatchedAt() : clock.instant();
        log.info("Dispatched {} as {} (timeout {}s, heartbeat stale after {}s)",
                command.operationId(), handle.id(), command.timeout().toSeconds(),
                staleThreshold(command).toSeconds());
        return new HeartbeatSupervision(command, handle, startedAt, staleThreshold(command), validationEnabled);
    }

    private Duration staleThreshold(RenderedCommand command) {
        return command.staleAfter() != null ? command.staleAfter() : defaultStaleThreshold;
    }

    private final class HeartbeatSupervision implements Supervision {

        private final RenderedCommand command;
        private final RemoteHandle handle;
        private final Instant startedAt;
        private final Duration staleThreshold;
        private final boolean validationEnabled;
        private Instant lastHeartbeat;

        HeartbeatSupervision(RenderedCommand command, RemoteHandle handle, Instant startedAt,
                             Duration staleThreshold, boolean validationEnabled) {
            this.command = command;
            this.handle = handle;
            this.startedAt = startedAt;
            this.staleThreshold = staleThreshold;
            this.validationEnabled = validationEnabled;
        }

        @Override
        public Optional<MonitorResult> tick(Instant now) {
            Duration elapsed = Duration.between(startedAt, now);
            RemoteStatus status = client.executionState(handle);

            switch (status.state()) {
                case SUCCEEDED -> {
                    return Optional.of(evaluate(status, elapsed));
                }
                case FAILED, CANCELED -> {
                    OutputTail tail = tailOf(status.output(), new MarkerTokenizer());
                    throw new OperationExecutionException(
                            command.operationId() + " remote execution " + status.state().name().toLowerCase(Locale.ROOT),
                            status.exitCode(), tail.lines());
                }
                default -> {
                    // still pending or running
                }
            }

            if (elapsed.compareTo(command.timeout()) >= 0) {
                log.error("{} exceeded timeout of {}s, cancelling {}",
                        command.operationId(), command.timeout().toSeconds(), handle.id());
                client.cancel(handle);
                throw new OperationTimeoutException(command.operationId(), command.timeout());
            }

            client.readHeartbeat(handle).ifPresent(beat -> {
                if (lastHeartbeat == null || beat.isAfter(lastHeartbeat)) {
                    lastHeartbeat = beat;
                }
            });
            if (status.state() == RemoteExecutionState.RUNNING) {
                Instant reference = lastHeartbeat != null && lastHeartbeat.isAfter(startedAt) ? lastHeartbeat : startedAt;
                if (Duration.between(reference, now).compareTo(staleThreshold) > 0) {
                    log.error("{} is running but heartbeat is stale since {}; remote handle {} left for explicit cancel",
                            command.operationId(), reference, handle.id());
                    throw new StaleHeartbeatException(command.operationId(), reference, staleThreshold);
                }
            }
            log.info("{} {}: {}s elapsed, last heartbeat {}", command.operationId(),
                    status.state(), elapsed.toSeconds(), lastHeartbeat == null ? "none" : lastHeartbeat);
            return Optional.empty();
        }

        private MonitorResult evaluate(RemoteStatus status, Duration elapsed) {
            MarkerTokenizer tokenizer = new MarkerTokenizer();
            OutputTail tail = tailOf(status.output(), tokenizer);
            int exitCode = status.exitCode() == null ? 0 : status.exitCode();
            if (exitCode != 0) {
                throw new OperationExecutionException(
                        command.operationId() + " remote exit code " + exitCode, exitCode, tail.lines());
            }
            if (tokenizer.errorSeen()) {
                throw new OperationExecutionException(
                        command.operationId() + " reported [ERROR]: " + tokenizer.errors().get(0), exitCode, tail.lines());
            }
            boolean suspicious = validationEnabled && !tokenizer.successSeen();
            if (suspicious) {
                log.warn("{} completed remotely without a [SUCCESS] marker; treating result as suspicious",
                        command.operationId());
            }
            log.info("{} completed remotely in {}s", command.operationId(), elapsed.toSeconds());
            return new MonitorResult(exitCode, elapsed, suspicious, tokenizer.warnings(), tail.lines(),
                    tail.captured(), null);
        }

        private OutputTail tailOf(String output, MarkerTokenizer tokenizer) {
            OutputTail tail = new OutputTail(OutputTail.DEFAULT_LINES);
            if (output != null) {
                output.lines().forEach(line -> {
                    tail.add(line);
                    tokenizer.feed(line);
                });
            }
            return tail;
        }

        @Override
        public void cancel() {
            log.warn("Cancelling remote execution {} for {}", handle.id(), command.operationId());
            client.cancel(handle);
        }
    }
}
