package stratus.engine.error;

import java.time.Duration;
import java.time.Instant;

/**
 * Remote dispatcher still reports the work as running, but its heartbeat artifact
 * has not been refreshed within the staleness threshold. Distinct from a timeout:
 * the process may be alive but is making no progress.
 */
public class StaleHeartbeatException extends EngineException {

    private final Instant lastHeartbeat;
    private final Duration threshold;

    public StaleHeartbeatException(String operationId, Instant lastHeartbeat, Duration threshold) {
        super("Operation " + operationId + " appears hung: no heartbeat since " + lastHeartbeat
                + " (threshold " + threshold.toSeconds() + "s)");
        this.lastHeartbeat = lastHeartbeat;
        this.threshold = threshold;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Duration threshold() {
        return threshold;
    }
}
