package stratus.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import stratus.engine.error.ValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads workflow documents (YAML, or JSON by extension) with root key {@code workflow}.
 * Structural checks are left to {@link WorkflowOrchestrator#validate}.
 */
public class WorkflowParser {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    public WorkflowDefinition parse(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Workflow file not found: " + file);
        }
        try {
            String content = Files.readString(file);
            return parse(content, file);
        } catch (IOException e) {
            throw new ValidationException("Cannot read workflow " + file + ": " + e.getMessage());
        }
    }

    public WorkflowDefinition parse(String content, Path source) {
        JsonNode root;
        try {
            boolean json = source != null && source.toString().toLowerCase(Locale.ROOT).endsWith(".json");
            root = (json ? JSON : YAML).readTree(content);
        } catch (IOException e) {
            throw new ValidationException("Malformed workflow " + source + ": " + e.getMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Workflow " + source + " is empty or not a mapping");
        }
        JsonNode node = root.has("workflow") ? root.get("workflow") : root;

        List<WorkflowStep> steps = new ArrayList<>();
        int index = 1;
        for (JsonNode step : node.path("steps")) {
            steps.add(new WorkflowStep(index++,
                    text(step, "name"),
                    text(step, "operation"),
                    parameters(step.path("parameters")),
                    step.path("continue_on_error").asBoolean(false)));
        }
        return new WorkflowDefinition(text(node, "id"), text(node, "name"), text(node, "description"), steps, source);
    }

    private static Map<String, JsonNode> parameters(JsonNode node) {
        Map<String, JsonNode> params = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            params.put(field.getKey(), field.getValue());
        }
        return params;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
