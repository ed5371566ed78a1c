package stratus.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import stratus.engine.graph.ResourceIds;
import stratus.engine.model.Resource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps control-plane JSON documents to {@link Resource} rows.
 */
final class ResourceJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResourceJson() {
    }

    /**
     * @return a resource when the node is an object carrying {@code id} and {@code type}
     */
    static Optional<Resource> toResource(JsonNode node) {
        if (node == null || !node.isObject() || !node.hasNonNull("id") || !node.hasNonNull("type")) {
            return Optional.empty();
        }
        String id = node.get("id").asText();
        JsonNode props = node.path("properties");
        Map<String, String> tags = new LinkedHashMap<>();
        node.path("tags").fields().forEachRemaining(e -> tags.put(e.getKey(), e.getValue().asText()));

        String scope = node.hasNonNull("resourceGroup") ? node.get("resourceGroup").asText() : ResourceIds.resourceGroup(id).orElse(null);
        Resource.Builder builder = Resource.builder()
                .id(id)
                .type(node.get("type").asText())
                .name(node.hasNonNull("name") ? node.get("name").asText() : null)
                .scope(scope)
                .subscriptionId(ResourceIds.subscription(id).orElse(null))
                .location(node.hasNonNull("location") ? node.get("location").asText() : null)
                .provisioningState(props.hasNonNull("provisioningState") ? props.get("provisioningState").asText() : null)
                .properties(node.toString())
                .tags(tags);
        return Optional.of(builder.build());
    }

    /**
     * Parse command output that may surround a JSON document with marker lines.
     */
    static Optional<JsonNode> parseOutput(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> whole = tryParse(output.trim());
        if (whole.isPresent()) {
            return whole;
        }
        int start = output.indexOf('{');
        int end = output.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return tryParse(output.substring(start, end + 1));
        }
        return Optional.empty();
    }

    static Optional<JsonNode> tryParse(String text) {
        try {
            return Optional.ofNullable(MAPPER.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
