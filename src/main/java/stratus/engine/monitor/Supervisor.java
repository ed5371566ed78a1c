package stratus.engine.monitor;

import stratus.engine.operation.RenderedCommand;

import java.time.Duration;

/**
 * Starts supervisions for one operation category.
 */
public interface Supervisor {

    /**
     * Launch the command and return its supervision.
     *
     * @param command           rendered command
     * @param runId             operation record id, names the log file
     * @param validationEnabled whether a missing [SUCCESS] marker is suspicious
     */
    Supervision start(RenderedCommand command, String runId, boolean validationEnabled);

    /** Interval between ticks. */
    Duration pollInterval(RenderedCommand command);
}
