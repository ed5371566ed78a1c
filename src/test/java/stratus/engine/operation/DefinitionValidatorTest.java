package stratus.engine.operation;

import stratus.engine.error.ValidationException;
import stratus.engine.model.OperationCategory;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionValidatorTest {

    @TempDir
    Path capabilities;

    private DefinitionValidator validator;

    @BeforeEach
    void setUp() throws Exception {
        Path ops = Files.createDirectories(capabilities.resolve("networking").resolve("operations"));
        Files.writeString(ops.resolve("01-vnet-create.yaml"),
                "operation: {id: vnet-create, name: Create VNet, template: \"az network vnet create\"}\n");
        validator = new DefinitionValidator(new OperationCatalog(capabilities, new OperationDefinitionParser()));
    }

    private static OperationDefinition.Builder valid() {
        return OperationDefinition.builder()
                .id("subnet-create")
                .name("Create subnet")
                .template(new TemplateSpec(TemplateType.CLOUD_CLI, "az network vnet subnet create", null, null))
                .requires(List.of(Prerequisite.required("vnet-create")));
    }

    @Test
    void acceptsWellFormedDefinition() {
        assertTrue(validator.problems(valid().build()).isEmpty());
        assertDoesNotThrow(() -> validator.validate(valid().build()));
    }

    @Test
    void reportsEveryProblemAtOnce() {
        OperationDefinition def = valid()
                .name(" ")
                .modeLabel("destroy")
                .duration(new DurationSpec(Duration.ofSeconds(300), Duration.ofSeconds(60), OperationCategory.WAIT, null))
                .idempotency(new IdempotencySpec(true, null, true))
                .parameters(Map.of("vnet-name", new ParameterSpec("vnet-name", ParameterType.STRING, true, null, null, null)))
                .requires(List.of(Prerequisite.required("subnet-create"), Prerequisite.required("route-table-create")))
                .build();

        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(def));

        List<String> problems = e.problems();
        assertEquals(7, problems.size(), problems.toString());
        assertTrue(problems.contains("operation.name is required"));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("operation_mode 'destroy'")));
        assertTrue(problems.contains("duration.timeout must not be shorter than duration.expected"));
        assertTrue(problems.contains("idempotency.check_command is required when idempotency is enabled"));
        assertTrue(problems.contains("parameter name 'vnet-name' is not a valid identifier"));
        assertTrue(problems.contains("operation cannot require itself"));
        assertTrue(problems.contains("required operation 'route-table-create' does not exist"));
    }

    @Test
    void requiresTemplateCommandAndVmForVmCommands() {
        List<String> missing = validator.problems(valid().template(null).build());
        assertEquals(List.of("template.command is required"), missing);

        List<String> noVm = validator.problems(valid()
                .template(new TemplateSpec(TemplateType.POWERSHELL_VM_COMMAND, "Write-Host hi", null, null))
                .build());
        assertEquals(List.of("template.vm_name is required for powershell-vm-command"), noVm);
    }

    @Test
    void rejectsNonPositiveExpectedDuration() {
        List<String> problems = validator.problems(valid()
                .duration(new DurationSpec(Duration.ZERO, Duration.ofSeconds(10), OperationCategory.FAST, null))
                .build());

        assertEquals(List.of("duration.expected must be positive"), problems);
    }
}
