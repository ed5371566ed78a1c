package stratus.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import stratus.engine.model.Resource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceJsonTest {

    private static final String VNET = "/subscriptions/sub-1/resourceGroups/rg-avd/providers/Microsoft.Network/virtualNetworks/vnet-avd";

    @Test
    void mapsControlPlaneDocument() {
        JsonNode node = ResourceJson.tryParse("""
                {"id": "%s", "type": "Microsoft.Network/virtualNetworks", "name": "vnet-avd",
                 "location": "eastus", "tags": {"env": "prod"},
                 "properties": {"provisioningState": "Succeeded"}}
                """.formatted(VNET)).orElseThrow();

        Resource resource = ResourceJson.toResource(node).orElseThrow();

        assertEquals(VNET, resource.id());
        assertEquals("vnet-avd", resource.name());
        assertEquals("rg-avd", resource.scope());
        assertEquals("sub-1", resource.subscriptionId());
        assertEquals("eastus", resource.location());
        assertEquals("Succeeded", resource.provisioningState());
        assertEquals(Map.of("env", "prod"), resource.tags());
        assertTrue(resource.properties().contains("provisioningState"));
    }

    @Test
    void explicitResourceGroupWins() {
        JsonNode node = ResourceJson.tryParse("{\"id\":\"" + VNET + "\",\"type\":\"t\",\"resourceGroup\":\"RG-AVD\"}")
                .orElseThrow();

        assertEquals("RG-AVD", ResourceJson.toResource(node).orElseThrow().scope());
    }

    @Test
    void requiresIdAndType() {
        assertTrue(ResourceJson.toResource(ResourceJson.tryParse("{\"id\":\"x\"}").orElseThrow()).isEmpty());
        assertTrue(ResourceJson.toResource(ResourceJson.tryParse("[1]").orElseThrow()).isEmpty());
        assertTrue(ResourceJson.toResource(null).isEmpty());
    }

    @Test
    void findsJsonBetweenMarkerLines() {
        String output = """
                [START] vnet-create
                [PROGRESS] creating
                {"id": "%s", "type": "Microsoft.Network/virtualNetworks"}
                [SUCCESS] vnet-create
                """.formatted(VNET);

        JsonNode node = ResourceJson.parseOutput(output).orElseThrow();

        assertEquals(VNET, node.get("id").asText());
        assertTrue(ResourceJson.parseOutput("[SUCCESS] nothing to report").isEmpty());
        assertTrue(ResourceJson.parseOutput("  ").isEmpty());
    }
}
