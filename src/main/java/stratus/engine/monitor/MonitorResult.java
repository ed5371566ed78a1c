package stratus.engine.monitor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Successful end of supervision.
 *
 * @param suspicious exit 0 without a {@code [SUCCESS]} marker while validation was enabled
 * @param output     captured output (size-capped), used to read JSON results
 * @param logFile    full output log, null for remote work
 */
public record MonitorResult(int exitCode, Duration elapsed, boolean suspicious, List<String> warnings,
        List<String> outputTail, String output, Path logFile) {
}
