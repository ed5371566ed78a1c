package stratus.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import stratus.engine.error.EngineException;
import stratus.engine.error.ValidationException;
import stratus.engine.model.DailyFailures;
import stratus.engine.model.OperationStats;
import stratus.engine.model.OperationTiming;
import stratus.engine.service.MetricsReport;
import stratus.engine.service.MetricsService;
import stratus.engine.store.JsonFiles;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "metrics", description = "Success rates and durations from the operation history")
final class MetricsCommand implements Callable<Integer> {

    enum Format { text, json }

    @ParentCommand
    StratusCommand root;

    @Spec
    CommandSpec spec;

    @Option(names = {"--capability"}, description = "Restrict totals and per-operation rows to one capability")
    String capability;

    @Option(names = {"--limit"}, defaultValue = "10", description = "Rows in the slowest and most failing lists")
    int limit;

    @Option(names = {"--days"}, defaultValue = "7", description = "Days of failure trend")
    int days;

    @Option(names = {"--format"}, defaultValue = "text", description = "text or json")
    Format format;

    @Option(names = {"-o", "--output"}, description = "Write the JSON report to this file")
    Path output;

    @Override
    public Integer call() throws IOException {
        if (limit < 1 || days < 1) {
            throw new ValidationException("--limit and --days must be positive");
        }
        PrintWriter out = spec.commandLine().getOut();
        MetricsReport report = root.deps().metricsService().report(capability, limit, days);

        if (output != null || format == Format.json) {
            String document = JsonFiles.mapper().writeValueAsString(MetricsService.toJson(report, Instant.now()));
            if (output == null) {
                out.println(document);
            } else {
                try {
                    Files.writeString(output, document, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new EngineException("Cannot write " + output + ": " + e.getMessage(), e);
                }
                out.println("Metrics written to " + output);
            }
            out.flush();
            return StratusCommand.EXIT_OK;
        }

        OperationStats overall = report.overall();
        out.printf(Locale.ROOT, "Operations%s: %d settled, %d succeeded, %d failed (%.2f%% success)%n",
                capability == null ? "" : " in " + capability, overall.total(), overall.succeeded(),
                overall.failed(), overall.successRate());
        if (overall.avgSeconds() != null) {
            out.printf(Locale.ROOT, "Duration: avg %.1fs, min %ds, max %ds, p50 %ds, p95 %ds%n", overall.avgSeconds(),
                    overall.minSeconds(), overall.maxSeconds(), report.p50Seconds(), report.p95Seconds());
        }
        printStats(out, "By capability", report.byCapability());
        printStats(out, "By mode", report.byMode());
        printStats(out, "By operation", report.byOperation());
        printStats(out, "Most failing", report.mostFailing());

        if (!report.slowest().isEmpty()) {
            out.println("Slowest:");
            for (OperationTiming timing : report.slowest()) {
                out.printf(Locale.ROOT, "  %-40s %6ds  %s%n", timing.operationId(), timing.durationSeconds(),
                        timing.status().label());
            }
        }
        if (!report.failureTrend().isEmpty()) {
            out.println("Failure trend:");
            for (DailyFailures day : report.failureTrend()) {
                out.printf(Locale.ROOT, "  %s  %d/%d failed (%.2f%%)%n", day.day(), day.failed(), day.total(), day.failureRate());
            }
        }
        out.flush();
        return StratusCommand.EXIT_OK;
    }

    private static void printStats(PrintWriter out, String title, List<OperationStats> rows) {
        if (rows.isEmpty()) {
            return;
        }
        out.println(title + ":");
        for (OperationStats row : rows) {
            out.printf(Locale.ROOT, "  %-40s %4d runs  %6.2f%% success  avg %s%n", row.key() == null ? "-" : row.key(),
                    row.total(), row.successRate(),
                    row.avgSeconds() == null ? "-" : String.format(Locale.ROOT, "%.1fs", row.avgSeconds()));
        }
    }
}
