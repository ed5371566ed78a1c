package stratus.engine.repository;

import stratus.engine.model.DailyFailures;
import stratus.engine.model.OperationStats;
import stratus.engine.model.OperationTiming;

import java.time.Instant;
import java.util.List;

/**
 * Read-only aggregates over settled (completed or failed) operation records.
 * Pending, running and skipped records never count.
 */
public interface MetricsRepository {

    /**
     * Totals over every settled record, or over one capability.
     *
     * @param capability capability filter, null for all
     * @return the overall row, with a null key
     */
    OperationStats overall(String capability);

    /**
     * One row per capability, slowest average first.
     */
    List<OperationStats> byCapability();

    /**
     * One row per execution mode, slowest average first.
     */
    List<OperationStats> byMode();

    /**
     * One row per operation id, optionally within one capability, most runs first.
     */
    List<OperationStats> byOperation(String capability);

    /**
     * Operation ids with at least one failure, most failures first.
     *
     * @param limit maximum rows
     */
    List<OperationStats> mostFailing(int limit);

    /**
     * Settled records with a duration, longest first.
     *
     * @param limit maximum rows
     */
    List<OperationTiming> slowest(int limit);

    /**
     * Per-day counts for records completed at or after {@code since}, newest day first.
     */
    List<DailyFailures> failureTrend(Instant since);

    /**
     * Every recorded duration in ascending order, optionally within one capability.
     */
    List<Long> durations(String capability);
}
