package stratus.engine.operation;

/**
 * Command template. For {@link TemplateType#POWERSHELL_VM_COMMAND} the target machine and
 * its scope are templates too.
 */
public record TemplateSpec(TemplateType type, String command, String vmName, String resourceGroup) {
}
