package stratus.engine.operation;

import stratus.engine.error.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Static checks on an operation definition. Every problem is reported at once.
 */
public class DefinitionValidator {

    private final OperationCatalog catalog;

    public DefinitionValidator(OperationCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @throws ValidationException listing every problem found
     */
    public void validate(OperationDefinition definition) {
        List<String> problems = problems(definition);
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid operation " + definition.id(), problems);
        }
    }

    public List<String> problems(OperationDefinition definition) {
        List<String> problems = new ArrayList<>();

        if (isBlank(definition.name())) {
            problems.add("operation.name is required");
        }
        if (definition.template() == null || isBlank(definition.template().command())) {
            problems.add("template.command is required");
        } else if (definition.template().type() == TemplateType.POWERSHELL_VM_COMMAND
                && isBlank(definition.template().vmName())) {
            problems.add("template.vm_name is required for " + TemplateType.POWERSHELL_VM_COMMAND.label());
        }
        if (definition.mode().isEmpty()) {
            problems.add("operation_mode '" + definition.modeLabel() + "' is not one of "
                    + Arrays.stream(ExecutionMode.values()).map(ExecutionMode::label)
                            .collect(Collectors.joining(", ")));
        }

        DurationSpec duration = definition.duration();
        if (duration.expected().isNegative() || duration.expected().isZero()) {
            problems.add("duration.expected must be positive");
        }
        if (duration.timeout().compareTo(duration.expected()) < 0) {
            problems.add("duration.timeout must not be shorter than duration.expected");
        }

        if (definition.idempotency().enabled() && isBlank(definition.idempotency().checkCommand())) {
            problems.add("idempotency.check_command is required when idempotency is enabled");
        }

        for (ParameterSpec parameter : definition.parameters().values()) {
            if (!parameter.name().matches("[A-Za-z_][A-Za-z0-9_]*")) {
                problems.add("parameter name '" + parameter.name() + "' is not a valid identifier");
            }
        }

        for (Prerequisite prerequisite : definition.requires()) {
            if (prerequisite.operation().equals(definition.id())) {
                problems.add("operation cannot require itself");
            } else if (!catalog.exists(prerequisite.operation())) {
                problems.add("required operation '" + prerequisite.operation() + "' does not exist");
            }
        }
        return problems;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
