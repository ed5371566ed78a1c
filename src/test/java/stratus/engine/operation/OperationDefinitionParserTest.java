package stratus.engine.operation;

import stratus.engine.error.ValidationException;
import stratus.engine.model.OperationCategory;
import stratus.engine.model.OperationStatus;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationDefinitionParserTest {

    private static final String GOLDEN_IMAGE = """
            operation:
              id: "golden-image-install-office"
              name: "Install Office"
              operation_mode: "modify"
              resource_type: "Microsoft.Compute/virtualMachines"
              duration:
                expected: 420
                timeout: 900
                type: "HEARTBEAT"
                stale_after: 300
              template:
                type: "powershell-vm-command"
                vm_name: "{{TEMP_VM_NAME}}"
                resource_group: "{{AZURE_RESOURCE_GROUP}}"
                command: |
                  Write-Host "[START] office"
                  Write-Host "[SUCCESS] office"
              validation:
                enabled: true
                checks:
                  - type: "command"
                    description: "Office installed"
                    command: "az vm run-command invoke --name {{TEMP_VM_NAME}}"
                    expect: "WINWORD"
                  - "az vm show -n {{TEMP_VM_NAME}}"
              idempotency:
                check_command: "az vm show -n {{TEMP_VM_NAME}}"
                skip_if_exists: false
              rollback:
                enabled: true
                steps:
                  - "echo undo-1"
                  - command: "echo undo-2"
              requires:
                - "golden-image-create-vm"
                - operation: "golden-image-configure-profile"
                  status: "skipped"
                  optional: true
              parameters:
                - name: "office_channel"
                  type: "string"
                  default: "MonthlyEnterprise"
                - name: "reboot"
                  type: "boolean"
                  required: true
                - name: "admin_password"
                  type: "securestring"
                  from_config: "AZURE.admin_password"
            """;

    private final OperationDefinitionParser parser = new OperationDefinitionParser();

    @Test
    void parsesEverySection() {
        OperationDefinition def = parser.parse(GOLDEN_IMAGE, Path.of("inline.yaml"));

        assertEquals("golden-image-install-office", def.id());
        assertEquals("Install Office", def.name());
        assertEquals(ExecutionMode.MODIFY, def.mode().orElseThrow());
        assertEquals("Microsoft.Compute/virtualMachines", def.resourceType());

        assertEquals(Duration.ofSeconds(420), def.duration().expected());
        assertEquals(Duration.ofSeconds(900), def.duration().timeout());
        assertEquals(OperationCategory.HEARTBEAT, def.duration().category());
        assertEquals(Duration.ofSeconds(300), def.duration().staleAfter());

        assertEquals(TemplateType.POWERSHELL_VM_COMMAND, def.template().type());
        assertEquals("{{TEMP_VM_NAME}}", def.template().vmName());
        assertTrue(def.template().command().contains("[SUCCESS] office"));

        assertTrue(def.validationEnabled());
        assertEquals(2, def.checks().size());
        assertEquals("Office installed", def.checks().get(0).description());
        assertEquals("WINWORD", def.checks().get(0).expect());
        assertEquals("az vm show -n {{TEMP_VM_NAME}}", def.checks().get(1).command());

        assertTrue(def.idempotency().declared(), "check_command implies enabled");
        assertFalse(def.idempotency().skipIfExists());

        assertTrue(def.rollback().enabled());
        assertEquals(List.of("echo undo-1", "echo undo-2"), def.rollback().steps());

        assertEquals(2, def.requires().size());
        assertEquals(Prerequisite.required("golden-image-create-vm"), def.requires().get(0));
        Prerequisite optional = def.requires().get(1);
        assertEquals(OperationStatus.SKIPPED, optional.status());
        assertTrue(optional.optional());

        assertEquals(List.of("office_channel", "reboot", "admin_password"), List.copyOf(def.parameters().keySet()));
        assertEquals(ParameterType.BOOL, def.parameters().get("reboot").type());
        assertTrue(def.parameters().get("reboot").required());
        assertEquals(ParameterType.SECRET, def.parameters().get("admin_password").type());
        assertEquals("AZURE.admin_password", def.parameters().get("admin_password").fromConfig());
        assertEquals("MonthlyEnterprise", def.parameters().get("office_channel").defaultValue().asText());
    }

    @Test
    void appliesDefaults() {
        OperationDefinition def = parser.parse("""
                operation:
                  id: vnet-create
                  name: Create VNet
                  template: "az network vnet create -n vnet"
                """, null);

        assertEquals(ExecutionMode.CREATE, def.mode().orElseThrow());
        assertEquals(DurationSpec.DEFAULT_EXPECTED, def.duration().expected());
        assertEquals(DurationSpec.DEFAULT_TIMEOUT, def.duration().timeout());
        assertEquals(OperationCategory.FAST, def.duration().category());
        assertNull(def.duration().staleAfter());
        assertEquals(TemplateType.SHELL, def.template().type());
        assertFalse(def.idempotency().declared());
        assertFalse(def.rollback().enabled());
        assertTrue(def.requires().isEmpty());
        assertTrue(def.parameters().isEmpty());
    }

    @Test
    void acceptsMappingParametersAndFractionalSeconds() {
        OperationDefinition def = parser.parse("""
                operation:
                  id: subnet-create
                  name: Create subnet
                  duration: { expected: 1.5, timeout: "30" }
                  template: { type: azure-cli, command: "az network vnet subnet create" }
                  parameters:
                    subnet_name: { type: string, required: true }
                    prefix_length: { type: integer, default: 24 }
                """, null);

        assertEquals(Duration.ofMillis(1500), def.duration().expected());
        assertEquals(Duration.ofSeconds(30), def.duration().timeout());
        assertEquals(TemplateType.CLOUD_CLI, def.template().type());
        assertEquals(ParameterType.NUMBER, def.parameters().get("prefix_length").type());
        assertEquals(24, def.parameters().get("prefix_length").defaultValue().asInt());
    }

    @Test
    void readsJsonByExtension(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("storage-create.json");
        Files.writeString(file, """
                {"operation": {"id": "storage-create", "name": "Create storage",
                 "template": {"type": "shell", "command": "echo ok"}}}
                """);

        OperationDefinition def = parser.parse(file);

        assertEquals("storage-create", def.id());
        assertEquals(file, def.source());
    }

    @Test
    void derivesCapabilityFromLayout(@TempDir Path dir) throws Exception {
        Path ops = Files.createDirectories(dir.resolve("networking").resolve("operations"));
        Path file = ops.resolve("01-vnet-create.yaml");
        Files.writeString(file, "operation: {id: vnet-create, name: VNet, template: \"echo\"}\n");

        assertEquals("networking", parser.parse(file).capability());
    }

    @Test
    void collectsStructuralProblemsTogether() {
        ValidationException e = assertThrows(ValidationException.class, () -> parser.parse("""
                operation:
                  id: broken
                  duration: { type: SLOW }
                  template: { type: telnet, command: "x" }
                  requires:
                    - { status: completed }
                  parameters:
                    - { name: count, type: complex }
                """, null));

        assertEquals(4, e.problems().size(), e.problems().toString());
        assertTrue(e.problems().get(0).contains("SLOW"));
        assertTrue(e.getMessage().contains("broken"));
    }

    @Test
    void rejectsMissingIdAndUnparsableDocuments() {
        ValidationException noId = assertThrows(ValidationException.class,
                () -> parser.parse("operation: {name: nameless}\n", null));
        assertEquals(List.of("operation.id is required"), noId.problems());

        assertThrows(ValidationException.class, () -> parser.parse("operation: [unclosed\n", null));
        assertThrows(ValidationException.class, () -> parser.parse("", null));
        assertThrows(ValidationException.class, () -> parser.parse(Path.of("does-not-exist.yaml")));
    }

    @Test
    void rejectsUnknownPrerequisiteStatus() {
        ValidationException e = assertThrows(ValidationException.class, () -> parser.parse("""
                operation:
                  id: x
                  template: "echo"
                  requires:
                    - { operation: y, status: finished }
                """, null));

        assertTrue(e.problems().get(0).contains("finished"));
    }
}
