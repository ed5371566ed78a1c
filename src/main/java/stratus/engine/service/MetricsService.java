package stratus.engine.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.model.DailyFailures;
import stratus.engine.model.OperationStats;
import stratus.engine.model.OperationTiming;
import stratus.engine.repository.MetricsRepository;
import stratus.engine.store.StorageRetry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Success rates and duration statistics derived from recorded operation history.
 */
public class MetricsService {

    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final MetricsRepository metrics;
    private final StorageRetry retry;
    private final Clock clock;

    public MetricsService(MetricsRepository metrics, StorageRetry retry, Clock clock) {
        this.metrics = metrics;
        this.retry = retry;
        this.clock = clock;
    }

    /**
     * Build a report.
     *
     * @param capability restrict totals, percentiles and the per-operation rows to one capability; null for all
     * @param limit      maximum rows in the slowest and most failing lists
     * @param trendDays  days of failure trend, counted back from now
     */
    public MetricsReport report(String capability, int limit, int trendDays) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (trendDays < 1) {
            throw new IllegalArgumentException("trendDays must be positive: " + trendDays);
        }
        Instant since = clock.instant().minus(Duration.ofDays(trendDays));
        return retry.call("build metrics report", () -> {
            List<Long> durations = metrics.durations(capability);
            MetricsReport report = new MetricsReport(capability,
                    metrics.overall(capability),
                    percentile(durations, 50).orElse(null),
                    percentile(durations, 95).orElse(null),
                    metrics.byCapability(),
                    metrics.byMode(),
                    metrics.byOperation(capability),
                    metrics.mostFailing(limit),
                    metrics.slowest(limit),
                    metrics.failureTrend(since));
            log.debug("Metrics report over {} settled operations", report.overall().total());
            return report;
        });
    }

    /**
     * Duration at the given percentile across settled operations.
     *
     * @param percentile 0 to 100
     * @return empty when no operation recorded a duration
     */
    public Optional<Long> durationPercentile(int percentile, String capability) {
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be between 0 and 100: " + percentile);
        }
        return percentile(retry.call("read operation durations", () -> metrics.durations(capability)), percentile);
    }

    /**
     * Nearest-rank percentile over an ascending list.
     */
    static Optional<Long> percentile(List<Long> ascending, int percentile) {
        if (ascending.isEmpty()) {
            return Optional.empty();
        }
        int rank = (int) Math.ceil(percentile / 100.0 * ascending.size());
        return Optional.of(ascending.get(Math.max(0, Math.min(rank, ascending.size()) - 1)));
    }

    /**
     * JSON document for export.
     */
    public static ObjectNode toJson(MetricsReport report, Instant generatedAt) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        root.put("generated_at", generatedAt.toString());
        root.put("capability", report.capability());
        ObjectNode overall = stats(report.overall());
        overall.remove("key");
        overall.put("p50_seconds", report.p50Seconds());
        overall.put("p95_seconds", report.p95Seconds());
        root.set("statistics", overall);
        root.set("by_capability", statsArray(report.byCapability()));
        root.set("by_mode", statsArray(report.byMode()));
        root.set("by_operation", statsArray(report.byOperation()));
        root.set("most_failing", statsArray(report.mostFailing()));

        ArrayNode slowest = root.putArray("slowest");
        for (OperationTiming timing : report.slowest()) {
            ObjectNode row = slowest.addObject();
            row.put("record_id", timing.recordId());
            row.put("operation_id", timing.operationId());
            row.put("capability", timing.capability());
            row.put("mode", timing.mode());
            row.put("status", timing.status().label());
            row.put("duration_seconds", timing.durationSeconds());
            row.put("completed_at", timing.completedAt() == null ? null : timing.completedAt().toString());
        }

        ArrayNode trend = root.putArray("failure_trend");
        for (DailyFailures day : report.failureTrend()) {
            ObjectNode row = trend.addObject();
            row.put("date", day.day().toString());
            row.put("total", day.total());
            row.put("failed", day.failed());
            row.put("failure_rate", day.failureRate());
        }
        return root;
    }

    private static ArrayNode statsArray(List<OperationStats> rows) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        rows.forEach(row -> array.add(stats(row)));
        return array;
    }

    private static ObjectNode stats(OperationStats stats) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("key", stats.key());
        node.put("total", stats.total());
        node.put("succeeded", stats.succeeded());
        node.put("failed", stats.failed());
        node.put("success_rate", stats.successRate());
        node.put("avg_seconds", stats.avgSeconds());
        node.put("min_seconds", stats.minSeconds());
        node.put("max_seconds", stats.maxSeconds());
        return node;
    }
}
