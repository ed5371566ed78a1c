package stratus.engine.client;

import stratus.engine.error.ValidationException;
import stratus.engine.operation.RenderedCommand;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a rendered command to the argv of the local process that runs it.
 */
public final class CommandLines {

    private static final boolean WINDOWS =
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    private final String cliExecutable;

    public CommandLines(String cliExecutable) {
        this.cliExecutable = cliExecutable;
    }

    public List<String> argv(RenderedCommand command) {
        return switch (command.type()) {
            case SHELL, CLOUD_CLI -> shell(command.command());
            case POWERSHELL_DIRECT -> List.of("pwsh", "-NoProfile", "-NonInteractive", "-Command", command.command());
            case POWERSHELL_VM_COMMAND -> vmCommand(command);
        };
    }

    /**
     * Command line for a plain shell string.
     */
    public static List<String> shell(String command) {
        if (WINDOWS) {
            return List.of("cmd.exe", "/c", command);
        }
        return List.of("sh", "-c", command);
    }

    private List<String> vmCommand(RenderedCommand command) {
        if (command.vmName() == null || command.vmName().isBlank()) {
            throw new ValidationException("Operation " + command.operationId() + " targets a VM but has no vm_name");
        }
        List<String> argv = new ArrayList<>(List.of(cliExecutable, "vm", "run-command", "invoke"));
        if (command.resourceGroup() != null && !command.resourceGroup().isBlank()) {
            argv.add("--resource-group");
            argv.add(command.resourceGroup());
        }
        argv.addAll(List.of("--name", command.vmName(),
                "--command-id", "RunPowerShellScript",
                "--scripts", command.command(),
                "--output", "json"));
        return argv;
    }
}
