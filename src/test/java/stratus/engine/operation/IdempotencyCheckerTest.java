package stratus.engine.operation;

import com.fasterxml.jackson.databind.node.TextNode;
import stratus.engine.client.FakeControlPlaneClient;
import stratus.engine.config.ConfigProvider;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyCheckerTest {

    private static final ConfigProvider CONFIG = key -> key.equals("AZURE_RESOURCE_GROUP")
            ? Optional.of("rg-avd")
            : Optional.empty();
    private static final String PROBE = "az network vnet show -g {{AZURE_RESOURCE_GROUP}} -n {{vnet_name}}";

    private FakeControlPlaneClient client;
    private IdempotencyChecker checker;
    private final ParameterResolver resolver = new ParameterResolver(CONFIG);

    @BeforeEach
    void setUp() {
        client = new FakeControlPlaneClient();
        checker = new IdempotencyChecker(client, new TemplateRenderer(CONFIG, null));
    }

    private static OperationDefinition definition(IdempotencySpec idempotency) {
        return OperationDefinition.builder()
                .id("vnet-create")
                .name("Create VNet")
                .template(new TemplateSpec(TemplateType.CLOUD_CLI, "az network vnet create", null, null))
                .idempotency(idempotency)
                .parameters(Map.of("vnet_name", new ParameterSpec("vnet_name", ParameterType.STRING, true, null,
                        null, null)))
                .build();
    }

    private IdempotencyResult check(IdempotencySpec spec) {
        OperationDefinition def = definition(spec);
        return checker.check(def, resolver.resolve(def, Map.of("vnet_name", TextNode.valueOf("vnet-avd"))));
    }

    @Test
    void notCheckedWithoutProbe() {
        assertEquals(IdempotencyResult.NOT_CHECKED, check(IdempotencySpec.none()));
        assertEquals(IdempotencyResult.NOT_CHECKED, check(new IdempotencySpec(true, " ", true)));
        assertTrue(client.commands().isEmpty());
    }

    @Test
    void rendersProbeAndSkipsWhenTargetExists() {
        client.on("vnet show", 0, "{\"id\":\"/subscriptions/s/resourceGroups/rg-avd/providers/Microsoft.Network/virtualNetworks/vnet-avd\"}");

        assertEquals(IdempotencyResult.ALREADY_SATISFIED, check(new IdempotencySpec(true, PROBE, true)));
        assertEquals(List.of("az network vnet show -g rg-avd -n vnet-avd"), client.commands());
    }

    @Test
    void satisfiedButNotSkippedWhenSkipIfExistsIsOff() {
        client.on("vnet show", 0, "{\"id\":\"x\"}");

        assertEquals(IdempotencyResult.SATISFIED_NO_SKIP, check(new IdempotencySpec(true, PROBE, false)));
    }

    @Test
    void emptyOrFailingProbeMeansNotSatisfied() {
        IdempotencySpec spec = new IdempotencySpec(true, PROBE, true);

        client.on("vnet show", 0, "[]");
        assertEquals(IdempotencyResult.NOT_SATISFIED, check(spec));

        setUp();
        client.on("vnet show", 0, "  null \n");
        assertEquals(IdempotencyResult.NOT_SATISFIED, check(spec));

        setUp();
        client.on("vnet show", 3, "{\"error\":\"ResourceNotFound\"}");
        assertEquals(IdempotencyResult.NOT_SATISFIED, check(spec));
    }
}
