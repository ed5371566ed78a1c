package stratus.engine.monitor;

import java.time.Instant;
import java.util.Optional;

/**
 * One supervised run, advanced by explicit ticks. Keeping the wait outside makes the
 * state machine synchronous and testable.
 */
public interface Supervision {

    /**
     * Observe the supervised work once.
     *
     * @param now current time
     * @return the result once the work has finished successfully, empty while it is still running
     * @throws stratus.engine.error.EngineException on failure, timeout or hang
     */
    Optional<MonitorResult> tick(Instant now);

    /**
     * Explicit cancellation requested by the caller.
     */
    void cancel();
}
