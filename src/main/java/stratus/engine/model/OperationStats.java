package stratus.engine.model;

/**
 * Aggregated outcome and duration figures for a group of settled operation records.
 *
 * @param key        the grouping value (operation id, capability or mode); null for the overall row
 * @param total      settled records in the group
 * @param succeeded  records that completed
 * @param failed     records that failed
 * @param avgSeconds mean duration, null when no record carries a duration
 * @param minSeconds shortest duration, null when no record carries a duration
 * @param maxSeconds longest duration, null when no record carries a duration
 */
public record OperationStats(String key, long total, long succeeded, long failed,
                             Double avgSeconds, Long minSeconds, Long maxSeconds) {

    /** Percentage of settled records that completed, 0 for an empty group. */
    public double successRate() {
        return total == 0 ? 0.0 : Math.round(10_000.0 * succeeded / total) / 100.0;
    }
}
