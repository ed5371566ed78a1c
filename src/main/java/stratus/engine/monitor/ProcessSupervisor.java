package stratus.engine.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.client.CommandLines;
import stratus.engine.error.EngineException;
import stratus.engine.error.OperationExecutionException;
import stratus.engine.error.OperationTimeoutException;
import stratus.engine.operation.RenderedCommand;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Supervises FAST and WAIT work as a local process.
 * <p>
 * A pump thread copies the combined output into the run's log file and onto a queue;
 * the supervising thread drains the queue on every tick and owns all marker state.
 */
public final class ProcessSupervisor implements Supervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final long DRAIN_WAIT_MS = 5_000;

    private final CommandLines commandLines;
    private final Path workingDir;
    private final Path logsDir;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration progressInterval;

    public ProcessSupervisor(CommandLines commandLines, Path workingDir, Path logsDir, Clock clock,
                             Duration pollInterval, Duration progressInterval) {
        this.commandLines = commandLines;
        this.workingDir = workingDir;
        this.logsDir = logsDir;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.progressInterval = progressInterval;
    }

    @Override
    public Duration pollInterval(RenderedCommand command) {
        return pollInterval;
    }

    @Override
    public Supervision start(RenderedCommand command, String runId, boolean validationEnabled) {
        List<String> argv = commandLines.argv(command);
        Path logFile = logsDir.resolve(runId + ".log");
        try {
            Files.createDirectories(logsDir);
            ProcessBuilder builder = new ProcessBuilder(argv).redirectErrorStream(true);
            if (workingDir != null && Files.isDirectory(workingDir)) {
                builder.directory(workingDir.toFile());
            }
            Process process = builder.start();
            log.info("Started {} [{}] pid={} expected={}s timeout={}s log={}",
                    command.operationId(), command.category(), process.pid(),
                    command.expected().toSeconds(), command.timeout().toSeconds(), logFile);
            return new ProcessSupervision(command, process, logFile, clock.instant(), validationEnabled);
        } catch (IOException e) {
            throw new EngineException("Failed to start " + command.operationId() + ": " + e.getMessage(), e);
        }
    }

    private final class ProcessSupervision implements Supervision {

        private final RenderedCommand command;
        private final Process process;
        private final Path logFile;
        private final Instant startedAt;
        private final boolean validationEnabled;
        private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        private final MarkerTokenizer tokenizer = new MarkerTokenizer();
        private final OutputTail tail = new OutputTail(OutputTail.DEFAULT_LINES);
        private final Thread pump;
        private final CompletableFuture<Instant> exitedAt;
        private Instant lastProgressLog;
        private boolean expectedExceeded;

        ProcessSupervision(RenderedCommand command, Process process, Path logFile, Instant startedAt,
                           boolean validationEnabled) {
            this.command = command;
            this.process = process;
            this.logFile = logFile;
            this.startedAt = startedAt;
            this.lastProgressLog = startedAt;
            this.validationEnabled = validationEnabled;
            this.exitedAt = process.onExit().thenApply(p -> clock.instant());
            this.pump = new Thread(this::pumpOutput, "stratus-pump-" + command.operationId());
            this.pump.setDaemon(true);
            this.pump.start();
        }

        private void pumpOutput() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
                 BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    writer.write(line);
                    writer.newLine();
                    writer.flush();
                    lines.add(line);
                }
            } catch (IOException e) {
                log.warn("Output pump for {} stopped: {}", command.operationId(), e.getMessage());
            }
        }

        @Override
        public Optional<MonitorResult> tick(Instant now) {
            drain();
            Duration elapsed = Duration.between(startedAt, now);

            if (!process.isAlive()) {
                awaitPump();
                drain();
                // measured at exit, not at this tick, so an overrun between polls is still caught
                Duration ran = Duration.between(startedAt, exitedAt.join());
                if (ran.compareTo(command.timeout()) > 0) {
                    log.error("{} exited after {}ms, past its timeout of {}s", command.operationId(), ran.toMillis(),
                            command.timeout().toSeconds());
                    throw new OperationTimeoutException(command.operationId(), command.timeout());
                }
                return Optional.of(evaluate(process.exitValue(), ran));
            }

            if (elapsed.compareTo(command.timeout()) >= 0) {
                log.error("{} exceeded timeout of {}s, terminating", command.operationId(), command.timeout().toSeconds());
                terminate();
                throw new OperationTimeoutException(command.operationId(), command.timeout());
            }

            if (!expectedExceeded && elapsed.compareTo(command.expected()) > 0) {
                expectedExceeded = true;
                log.warn("{} is taking longer than expected ({}s > {}s)",
                        command.operationId(), elapsed.toSeconds(), command.expected().toSeconds());
            }
            if (Duration.between(lastProgressLog, now).compareTo(progressInterval) >= 0) {
                lastProgressLog = now;
                log.info("{} running: {}s elapsed, phase {}{}", command.operationId(), elapsed.toSeconds(),
                        tokenizer.phase(), tokenizer.lastProgress().map(p -> " - " + p).orElse(""));
            }
            return Optional.empty();
        }

        private void drain() {
            List<String> batch = new ArrayList<>();
            lines.drainTo(batch);
            for (String line : batch) {
                tail.add(line);
                tokenizer.feed(line).ifPresent(match -> {
                    switch (match.marker()) {
                        case PROGRESS, START, VALIDATE, SUCCESS -> log.debug("{} {} {}",
                                command.operationId(), match.marker().token(), match.message());
                        case ERROR -> log.error("{} reported error: {}", command.operationId(), match.message());
                        case WARNING -> log.warn("{} reported warning: {}", command.operationId(), match.message());
                        case MONITOR -> log.info("{} {}", command.operationId(), match.message());
                    }
                });
            }
        }

        private MonitorResult evaluate(int exitCode, Duration elapsed) {
            if (exitCode != 0) {
                String detail = tokenizer.errors().isEmpty() ? "" : ": " + tokenizer.errors().get(0);
                throw new OperationExecutionException(
                        command.operationId() + " exited with code " + exitCode + detail, exitCode, tail.lines());
            }
            if (tokenizer.errorSeen()) {
                throw new OperationExecutionException(
                        command.operationId() + " reported [ERROR]: " + tokenizer.errors().get(0), exitCode, tail.lines());
            }
            boolean suspicious = validationEnabled && !tokenizer.successSeen();
            if (suspicious) {
                log.warn("{} exited 0 without a [SUCCESS] marker; treating result as suspicious", command.operationId());
            }
            log.info("{} finished in {}s", command.operationId(), elapsed.toSeconds());
            return new MonitorResult(exitCode, elapsed, suspicious, tokenizer.warnings(), tail.lines(),
                    tail.captured(), logFile);
        }

        private void awaitPump() {
            try {
                pump.join(DRAIN_WAIT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void terminate() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            try {
                process.waitFor(DRAIN_WAIT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            awaitPump();
            drain();
        }

        @Override
        public void cancel() {
            if (process.isAlive()) {
                log.warn("Cancelling {}", command.operationId());
                terminate();
            }
        }
    }
}
