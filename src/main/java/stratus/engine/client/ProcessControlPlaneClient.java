package stratus.engine.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.error.EngineException;
import stratus.engine.error.OperationExecutionException;
import stratus.engine.error.ValidationException;
import stratus.engine.operation.RenderedCommand;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Control-plane client that shells out to the cloud CLI and reads its JSON output.
 * <p>
 * Remote work is dispatched as an asynchronous VM run-command. The dispatched script gets
 * {@code $env:STRATUS_HEARTBEAT_FILE} pointing at the artifact it is expected to refresh.
 */
public final class ProcessControlPlaneClient implements CloudControlPlaneClient {

    private static final Logger log = LoggerFactory.getLogger(ProcessControlPlaneClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String HEARTBEAT_DIR = "C:\\stratus\\heartbeat\\";

    static final int TIMED_OUT_EXIT = 124;

    private final String cli;
    private final Path workingDir;
    private final Duration commandTimeout;
    private final Clock clock;

    public ProcessControlPlaneClient(String cli, Path workingDir, Duration commandTimeout, Clock clock) {
        this.cli = cli;
        this.workingDir = workingDir;
        this.commandTimeout = commandTimeout;
        this.clock = clock;
    }

    @Override
    public CommandResult run(String command) {
        log.debug("Running: {}", command);
        return exec(CommandLines.shell(command));
    }

    @Override
    public RemoteHandle dispatch(RenderedCommand command) {
        if (command.vmName() == null || command.vmName().isBlank()) {
            throw new ValidationException("Operation " + command.operationId() + " dispatches remote work but has no vm_name");
        }
        Instant now = clock.instant();
        String runName = "stratus-" + command.operationId().replaceAll("[^A-Za-z0-9-]", "-").toLowerCase(Locale.ROOT)
                + "-" + now.getEpochSecond();
        String heartbeatFile = HEARTBEAT_DIR + runName + ".txt";
        String script = "$env:STRATUS_HEARTBEAT_FILE = '" + heartbeatFile + "'\n" + command.command();

        List<String> argv = new ArrayList<>(List.of(cli, "vm", "run-command", "create"));
        addGroup(argv, command.resourceGroup());
        argv.addAll(List.of("--vm-name", command.vmName(), "--name", runName,
                "--script", script, "--async-execution", "true", "--output", "json"));

        CommandResult result = exec(argv);
        if (!result.succeeded()) {
            throw new OperationExecutionException("Dispatch of " + command.operationId() + " to "
                    + command.vmName() + " failed", result.exitCode(), tail(result));
        }
        Map<String, String> attributes = new HashMap<>();
        attributes.put("vmName", command.vmName());
        attributes.put("heartbeatFile", heartbeatFile);
        if (command.resourceGroup() != null) {
            attributes.put("resourceGroup", command.resourceGroup());
        }
        return new RemoteHandle(runName, now, attributes);
    }

    @Override
    public RemoteStatus executionState(RemoteHandle handle) {
        List<String> argv = new ArrayList<>(List.of(cli, "vm", "run-command", "show"));
        addGroup(argv, handle.attribute("resourceGroup"));
        argv.addAll(List.of("--vm-name", handle.attribute("vmName"), "--name", handle.id(),
                "--instance-view", "--output", "json"));
        CommandResult result = exec(argv);
        if (!result.succeeded()) {
            log.warn("Could not read state of {}: exit {}", handle.id(), result.exitCode());
            return new RemoteStatus(RemoteExecutionState.UNKNOWN, "", null);
        }
        JsonNode view = parse(result.output()).path("instanceView");
        RemoteExecutionState state = RemoteExecutionState.fromDispatcher(view.path("executionState").asText(null));
        StringBuilder output = new StringBuilder(view.path("output").asText(""));
        String error = view.path("error").asText("");
        if (!error.isBlank()) {
            output.append('\n').append(error);
        }
        Integer exitCode = view.hasNonNull("exitCode") ? view.get("exitCode").asInt() : null;
        return new RemoteStatus(state, output.toString(), exitCode);
    }

    @Override
    public Optional<Instant> readHeartbeat(RemoteHandle handle) {
        String file = handle.attribute("heartbeatFile");
        String probe = "if (Test-Path '" + file + "') { (Get-Item '" + file + "').LastWriteTimeUtc.ToString('o') }";
        List<String> argv = new ArrayList<>(List.of(cli, "vm", "run-command", "invoke"));
        addGroup(argv, handle.attribute("resourceGroup"));
        argv.addAll(List.of("--name", handle.attribute("vmName"), "--command-id", "RunPowerShellScript",
                "--scripts", probe, "--output", "json"));
        CommandResult result = exec(argv);
        if (!result.succeeded()) {
            log.debug("Heartbeat probe for {} failed with exit {}", handle.id(), result.exitCode());
            return Optional.empty();
        }
        String message = parse(result.output()).path("value").path(0).path("message").asText("").trim();
        if (message.isEmpty()) {
            return Optional.empty();
        }
        String timestamp = message.lines().map(String::trim).filter(l -> !l.isEmpty()).findFirst().orElse("");
        try {
            return Optional.of(Instant.parse(timestamp));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable heartbeat '{}' for {}", timestamp, handle.id());
            return Optional.empty();
        }
    }

    @Override
    public void cancel(RemoteHandle handle) {
        List<String> argv = new ArrayList<>(List.of(cli, "vm", "run-command", "delete"));
        addGroup(argv, handle.attribute("resourceGroup"));
        argv.addAll(List.of("--vm-name", handle.attribute("vmName"), "--name", handle.id(), "--yes"));
        CommandResult result = exec(argv);
        if (result.succeeded()) {
            log.info("Cancelled remote execution {}", handle.id());
        } else {
            log.error("Cancel of remote execution {} failed (exit {}): {}", handle.id(), result.exitCode(),
                    String.join(" | ", tail(result)));
        }
    }

    @Override
    public Optional<String> showResource(String resourceId) {
        CommandResult result = exec(List.of(cli, "resource", "show", "--ids", resourceId, "--output", "json"));
        if (result.succeeded()) {
            return result.hasContent() ? Optional.of(result.output()) : Optional.empty();
        }
        String output = result.output() == null ? "" : result.output();
        if (output.contains("ResourceNotFound") || output.toLowerCase(Locale.ROOT).contains("not found")) {
            return Optional.empty();
        }
        throw new EngineException("resource show failed for " + resourceId + " (exit " + result.exitCode() + ")");
    }

    @Override
    public String listResources(String scope) {
        CommandResult result = exec(List.of(cli, "resource", "list", "--resource-group", scope, "--output", "json"));
        if (!result.succeeded()) {
            throw new EngineException("resource list failed for " + scope + " (exit " + result.exitCode() + "): "
                    + String.join(" | ", tail(result)));
        }
        return result.output();
    }

    private CommandResult exec(List<String> argv) {
        ProcessBuilder builder = new ProcessBuilder(argv).redirectErrorStream(true);
        if (workingDir != null && Files.isDirectory(workingDir)) {
            builder.directory(workingDir.toFile());
        }
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new EngineException("Failed to start " + argv.get(0) + ": " + e.getMessage(), e);
        }
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                log.warn("{} did not finish within {}s", argv.get(0), commandTimeout.toSeconds());
                return new CommandResult(TIMED_OUT_EXIT, output.getNow(""));
            }
            return new CommandResult(process.exitValue(), output.get(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new EngineException("Interrupted while running " + argv.get(0), e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Output of {} could not be collected: {}", argv.get(0), e.toString());
            return new CommandResult(process.exitValue(), "");
        }
    }

    private static String readAll(InputStream in) {
        try (in; ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed reading process output: {}", e.getMessage());
            return "";
        }
    }

    private static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json == null || json.isBlank() ? "{}" : json);
        } catch (IOException e) {
            throw new EngineException("Unexpected non-JSON output from control plane: " + e.getMessage(), e);
        }
    }

    private static void addGroup(List<String> argv, String resourceGroup) {
        if (resourceGroup != null && !resourceGroup.isBlank()) {
            argv.add("--resource-group");
            argv.add(resourceGroup);
        }
    }

    private static List<String> tail(CommandResult result) {
        List<String> lines = result.lines();
        return lines.subList(Math.max(0, lines.size() - 20), lines.size());
    }
}
