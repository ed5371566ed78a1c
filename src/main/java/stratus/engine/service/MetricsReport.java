package stratus.engine.service;

import stratus.engine.model.DailyFailures;
import stratus.engine.model.OperationStats;
import stratus.engine.model.OperationTiming;

import java.util.List;

/**
 * Snapshot of operation history: totals, breakdowns, slowest runs and the recent failure trend.
 *
 * @param capability the capability the report is restricted to, null for all
 * @param p50Seconds median duration, null without durations
 * @param p95Seconds 95th percentile duration, null without durations
 */
public record MetricsReport(String capability,
                            OperationStats overall,
                            Long p50Seconds,
                            Long p95Seconds,
                            List<OperationStats> byCapability,
                            List<OperationStats> byMode,
                            List<OperationStats> byOperation,
                            List<OperationStats> mostFailing,
                            List<OperationTiming> slowest,
                            List<DailyFailures> failureTrend) {
}
