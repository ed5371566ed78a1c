package stratus.engine.operation;

import java.util.Locale;
import java.util.Optional;

/**
 * How a rendered command is launched.
 */
public enum TemplateType {
    /** POSIX shell command line */
    SHELL("shell"),
    /** Cloud CLI invocation, run through the shell */
    CLOUD_CLI("cloud-cli"),
    /** PowerShell on the local machine */
    POWERSHELL_DIRECT("powershell-direct"),
    /** PowerShell script executed inside a target VM through the control plane */
    POWERSHELL_VM_COMMAND("powershell-vm-command");

    private final String label;

    TemplateType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<TemplateType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.of(SHELL);
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("azure-cli") || normalized.equals("bash")) {
            return Optional.of(normalized.equals("bash") ? SHELL : CLOUD_CLI);
        }
        for (TemplateType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
