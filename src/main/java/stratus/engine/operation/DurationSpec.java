package stratus.engine.operation;

import stratus.engine.model.OperationCategory;

import java.time.Duration;

/**
 * Expected and maximum run time plus the supervision category.
 *
 * @param staleAfter heartbeat staleness threshold override, null for the configured default
 */
public record DurationSpec(Duration expected, Duration timeout, OperationCategory category, Duration staleAfter) {

    public static final Duration DEFAULT_EXPECTED = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public static DurationSpec defaults() {
        return new DurationSpec(DEFAULT_EXPECTED, DEFAULT_TIMEOUT, OperationCategory.FAST, null);
    }
}
