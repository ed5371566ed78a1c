package stratus.engine.model;

import java.time.LocalDate;

/**
 * Settled and failed record counts for one calendar day of the state store.
 */
public record DailyFailures(LocalDate day, long total, long failed) {

    public double failureRate() {
        return total == 0 ? 0.0 : Math.round(10_000.0 * failed / total) / 100.0;
    }
}
