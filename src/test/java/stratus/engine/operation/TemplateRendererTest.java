package stratus.engine.operation;

import com.fasterxml.jackson.databind.node.TextNode;
import stratus.engine.config.ConfigProvider;
import stratus.engine.error.ValidationException;
import stratus.engine.model.OperationCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRendererTest {

    private static final ConfigProvider CONFIG = key -> switch (key) {
        case "AZURE_RESOURCE_GROUP" -> Optional.of("rg-avd");
        case "VNET_PREFIX" -> Optional.of("10.1.0.0/16");
        default -> Optional.empty();
    };

    private final TemplateRenderer renderer = new TemplateRenderer(CONFIG, null);
    private final ParameterResolver resolver = new ParameterResolver(CONFIG);

    private static OperationDefinition definition(TemplateSpec template, Map<String, ParameterSpec> parameters) {
        return OperationDefinition.builder()
                .id("vnet-create")
                .name("Create VNet")
                .template(template)
                .duration(new DurationSpec(Duration.ofSeconds(30), Duration.ofSeconds(90), OperationCategory.WAIT,
                        null))
                .parameters(parameters)
                .build();
    }

    @Test
    void substitutesParametersAndConfig() {
        OperationDefinition def = definition(new TemplateSpec(TemplateType.CLOUD_CLI,
                "az network vnet create -g {{AZURE_RESOURCE_GROUP}} -n {{ vnet_name }} --address-prefixes {{VNET_PREFIX}}",
                null, null), Map.of("vnet_name", new ParameterSpec("vnet_name", ParameterType.STRING, true, null,
                        null, null)));
        ResolvedParameters params = resolver.resolve(def, Map.of("vnet_name", TextNode.valueOf("vnet-avd")));

        RenderedCommand rendered = renderer.render(def, params);

        assertEquals("az network vnet create -g rg-avd -n vnet-avd --address-prefixes 10.1.0.0/16", rendered.command());
        assertEquals(OperationCategory.WAIT, rendered.category());
        assertEquals(Duration.ofSeconds(90), rendered.timeout());
        assertEquals(TemplateType.CLOUD_CLI, rendered.type());
    }

    @Test
    void configOverridesDocumentedDefault() {
        OperationDefinition def = definition(new TemplateSpec(TemplateType.SHELL, "echo {{VNET_PREFIX}}", null, null),
                Map.of("VNET_PREFIX", new ParameterSpec("VNET_PREFIX", ParameterType.STRING, false,
                        TextNode.valueOf("10.0.0.0/16"), null, null)));

        RenderedCommand rendered = renderer.render(def, resolver.resolve(def, Map.of()));

        assertEquals("echo 10.1.0.0/16", rendered.command());
    }

    @Test
    void unresolvedTokenIsAnError() {
        OperationDefinition def = definition(new TemplateSpec(TemplateType.SHELL,
                "az vm create -n {{VM_NAME}} --image {{IMAGE_ID}} -g {{AZURE_RESOURCE_GROUP}}", null, null), Map.of());

        ValidationException e = assertThrows(ValidationException.class,
                () -> renderer.render(def, ResolvedParameters.empty()));

        assertEquals(2, e.problems().size());
        assertEquals("unresolved token {{VM_NAME}}", e.problems().get(0));
        assertEquals("unresolved token {{IMAGE_ID}}", e.problems().get(1));
    }

    @Test
    void malformedPlaceholdersAreReportedNotEmitted() {
        OperationDefinition def = definition(new TemplateSpec(TemplateType.CLOUD_CLI,
                "az group show -n {{RESOURCE-GROUP}} {{vm.name}} -g {{AZURE_RESOURCE_GROUP}}", null, null), Map.of());

        ValidationException e = assertThrows(ValidationException.class,
                () -> renderer.render(def, ResolvedParameters.empty()));

        assertEquals(List.of("unresolved token {{RESOURCE-GROUP}}", "unresolved token {{vm.name}}"), e.problems());
    }

    @Test
    void vmTargetIsRenderedToo() {
        OperationDefinition def = definition(new TemplateSpec(TemplateType.POWERSHELL_VM_COMMAND,
                "Write-Host '[START]'", "{{vm_name}}", "{{AZURE_RESOURCE_GROUP}}"),
                Map.of("vm_name", new ParameterSpec("vm_name", ParameterType.STRING, true, null, null, null)));

        RenderedCommand rendered = renderer.render(def,
                resolver.resolve(def, Map.of("vm_name", TextNode.valueOf("gm-temp-vm"))));

        assertEquals("gm-temp-vm", rendered.vmName());
        assertEquals("rg-avd", rendered.resourceGroup());
    }

    @Test
    void replacementTextIsLiteral() {
        ResolvedParameters params = resolver.resolve("x",
                Map.of("path", new ParameterSpec("path", ParameterType.STRING, true, null, null, null)),
                Map.of("path", TextNode.valueOf("C:\\temp\\$1")));

        assertEquals("copy C:\\temp\\$1", renderer.substitute("copy {{path}}", params, "x"));
    }

    @Test
    void tokensAreListedInOrder() {
        assertEquals(Set.of("A", "B"), TemplateRenderer.tokens("{{A}} {{ B }} {{A}}"));
        assertTrue(TemplateRenderer.tokens("no tokens {here}").isEmpty());
    }
}
