package stratus.engine.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import stratus.engine.config.ConfigProvider;
import stratus.engine.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParameterResolverTest {

    private static final ConfigProvider CONFIG = key -> key.equals("AZURE_LOCATION")
            ? Optional.of("eastus")
            : Optional.empty();

    private final ParameterResolver resolver = new ParameterResolver(CONFIG);

    private static Map<String, ParameterSpec> schema(ParameterSpec... specs) {
        Map<String, ParameterSpec> schema = new LinkedHashMap<>();
        for (ParameterSpec spec : specs) {
            schema.put(spec.name(), spec);
        }
        return schema;
    }

    private static ParameterSpec param(String name, ParameterType type, boolean required, JsonNode defaultValue,
            String fromConfig) {
        return new ParameterSpec(name, type, required, defaultValue, fromConfig, null);
    }

    @Test
    void userValueWinsOverConfigAndDefault() {
        ResolvedParameters params = resolver.resolve("vnet-create",
                schema(param("location", ParameterType.STRING, true, TextNode.valueOf("westus"), "AZURE_LOCATION")),
                Map.of("location", TextNode.valueOf("northeurope")));

        assertEquals("northeurope", params.string("location").orElseThrow());
        assertEquals(ValueSource.USER, params.get("location").orElseThrow().source());
    }

    @Test
    void configValueWinsOverDefault() {
        ResolvedParameters params = resolver.resolve("vnet-create",
                schema(param("location", ParameterType.STRING, true, TextNode.valueOf("westus"), "AZURE_LOCATION")),
                Map.of());

        assertEquals("eastus", params.string("location").orElseThrow());
        assertEquals(ValueSource.CONFIG, params.get("location").orElseThrow().source());
    }

    @Test
    void defaultIsLastResort() {
        ResolvedParameters params = resolver.resolve("vnet-create",
                schema(param("prefix", ParameterType.STRING, false, TextNode.valueOf("10.0.0.0/16"), "UNSET_KEY")),
                Map.of());

        assertEquals("10.0.0.0/16", params.string("PREFIX").orElseThrow());
        assertEquals(ValueSource.DEFAULT, params.get("prefix").orElseThrow().source());
    }

    @Test
    void missingRequiredValuesAreReportedTogether() {
        ValidationException e = assertThrows(ValidationException.class, () -> resolver.resolve("vnet-create",
                schema(param("vnet_name", ParameterType.STRING, true, null, null),
                        param("subnet_name", ParameterType.STRING, true, null, "SUBNET_NAME"),
                        param("optional_tag", ParameterType.STRING, false, null, null)),
                Map.of()));

        List<String> problems = e.problems();
        assertEquals(2, problems.size());
        assertTrue(problems.get(0).contains("vnet_name"));
        assertTrue(problems.get(1).contains("SUBNET_NAME"));
    }

    @Test
    void valuesAreCoercedToDeclaredTypes() {
        ResolvedParameters params = resolver.resolve("host-pool",
                schema(param("max_sessions", ParameterType.NUMBER, true, null, null),
                        param("validation_env", ParameterType.BOOL, true, null, null),
                        param("tags", ParameterType.OBJECT, false, null, null)),
                Map.of("max_sessions", TextNode.valueOf("12"),
                        "validation_env", TextNode.valueOf("yes"),
                        "tags", TextNode.valueOf("{\"env\":\"prod\"}")));

        assertEquals(12L, params.get("max_sessions").orElseThrow().value().asLong());
        assertTrue(params.get("validation_env").orElseThrow().value().asBoolean());
        assertEquals("prod", params.get("tags").orElseThrow().value().path("env").asText());
        assertEquals("{\"env\":\"prod\"}", params.string("tags").orElseThrow());
    }

    @Test
    void typeMismatchIsAValidationError() {
        ValidationException e = assertThrows(ValidationException.class, () -> resolver.resolve("host-pool",
                schema(param("max_sessions", ParameterType.NUMBER, true, null, null),
                        param("enabled", ParameterType.BOOL, true, null, null)),
                Map.of("max_sessions", TextNode.valueOf("many"), "enabled", IntNode.valueOf(3))));

        assertEquals(2, e.problems().size());
        assertTrue(e.problems().get(0).contains("expected number"));
    }

    @Test
    void undeclaredUserParametersPassThrough() {
        ResolvedParameters params = resolver.resolve("vnet-create", schema(),
                Map.of("extra", TextNode.valueOf("value")));

        assertEquals("value", params.string("extra").orElseThrow());
    }

    @Test
    void secretsAreMaskedInSnapshot() {
        ResolvedParameters params = resolver.resolve("domain-join",
                schema(param("password", ParameterType.SECRET, true, null, null),
                        param("domain", ParameterType.STRING, true, null, null)),
                Map.of("password", TextNode.valueOf("hunter2"), "domain", TextNode.valueOf("corp.local")));

        assertEquals("hunter2", params.string("password").orElseThrow());
        assertEquals(ResolvedParameters.MASK, params.snapshot().path("password").asText());
        assertEquals("corp.local", params.snapshot().path("domain").asText());
        assertFalse(params.toString().contains("hunter2"));
    }
}
