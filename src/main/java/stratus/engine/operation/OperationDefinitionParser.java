package stratus.engine.operation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import stratus.engine.error.ValidationException;
import stratus.engine.model.OperationCategory;
import stratus.engine.model.OperationStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads operation definition documents (YAML or JSON, root key {@code operation}).
 * Structural problems (unknown category, template or parameter type, unparsable prerequisite)
 * are collected and raised together as one {@link ValidationException}.
 */
public class OperationDefinitionParser {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    public OperationDefinition parse(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ValidationException("Cannot read operation definition " + file + ": " + e.getMessage());
        }
        return parse(content, file);
    }

    public OperationDefinition parse(String content, Path source) {
        JsonNode root = readTree(content, source);
        JsonNode op = root.has("operation") ? root.get("operation") : root;
        if (!op.isObject()) {
            throw new ValidationException("Malformed operation definition " + describe(source)
                    + ": expected an 'operation' mapping");
        }

        List<String> problems = new ArrayList<>();
        String id = text(op, "id");
        if (id == null) {
            throw new ValidationException("Malformed operation definition " + describe(source),
                    List.of("operation.id is required"));
        }

        OperationDefinition definition = OperationDefinition.builder()
                .id(id)
                .name(text(op, "name"))
                .description(text(op, "description"))
                .capability(capability(op, source))
                .modeLabel(firstText(op, "operation_mode", "mode", "type"))
                .resourceType(text(op, "resource_type"))
                .resourceName(text(op, "resource_name"))
                .duration(duration(op.path("duration"), problems))
                .validationEnabled(op.path("validation").path("enabled").asBoolean(false))
                .checks(checks(op.path("validation").path("checks")))
                .template(template(op.path("template"), problems))
                .idempotency(idempotency(op.path("idempotency")))
                .rollback(rollback(op.path("rollback")))
                .requires(requires(op.path("requires"), problems))
                .parameters(parameters(op.path("parameters"), problems))
                .source(source)
                .build();

        if (!problems.isEmpty()) {
            throw new ValidationException("Malformed operation definition " + id, problems);
        }
        return definition;
    }

    // ==================== Sections ====================

    private static DurationSpec duration(JsonNode node, List<String> problems) {
        Duration expected = seconds(node.path("expected"), DurationSpec.DEFAULT_EXPECTED);
        Duration timeout = seconds(node.path("timeout"), DurationSpec.DEFAULT_TIMEOUT);
        Duration staleAfter = seconds(node.path("stale_after"), null);
        OperationCategory category = OperationCategory.FAST;
        String type = text(node, "type");
        if (type != null) {
            try {
                category = OperationCategory.fromLabel(type);
            } catch (IllegalArgumentException e) {
                problems.add("duration.type '" + type + "' is not one of FAST, WAIT, HEARTBEAT");
            }
        }
        return new DurationSpec(expected, timeout, category, staleAfter);
    }

    private static List<PostCheck> checks(JsonNode node) {
        List<PostCheck> checks = new ArrayList<>();
        for (JsonNode check : node) {
            if (check.isTextual()) {
                checks.add(new PostCheck("command", null, check.asText(), null));
            } else {
                checks.add(new PostCheck(
                        check.path("type").asText("command"),
                        firstText(check, "description", "name"),
                        text(check, "command"),
                        text(check, "expect")));
            }
        }
        return checks;
    }

    private static TemplateSpec template(JsonNode node, List<String> problems) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return new TemplateSpec(TemplateType.SHELL, node.asText(), null, null);
        }
        String typeLabel = text(node, "type");
        TemplateType type = TemplateType.fromLabel(typeLabel).orElse(null);
        if (type == null) {
            problems.add("template.type '" + typeLabel + "' is not supported");
            type = TemplateType.SHELL;
        }
        return new TemplateSpec(type, text(node, "command"), text(node, "vm_name"), text(node, "resource_group"));
    }

    private static IdempotencySpec idempotency(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return IdempotencySpec.none();
        }
        String command = text(node, "check_command");
        return new IdempotencySpec(
                node.path("enabled").asBoolean(command != null),
                command,
                node.path("skip_if_exists").asBoolean(true));
    }

    private static RollbackSpec rollback(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return RollbackSpec.none();
        }
        List<String> steps = new ArrayList<>();
        for (JsonNode step : node.path("steps")) {
            String command = step.isTextual() ? step.asText() : text(step, "command");
            if (command != null) {
                steps.add(command);
            }
        }
        return new RollbackSpec(node.path("enabled").asBoolean(false), steps);
    }

    private static List<Prerequisite> requires(JsonNode node, List<String> problems) {
        List<Prerequisite> requires = new ArrayList<>();
        for (JsonNode entry : node) {
            if (entry.isTextual()) {
                requires.add(Prerequisite.required(entry.asText().trim()));
                continue;
            }
            String operation = text(entry, "operation");
            if (operation == null) {
                problems.add("requires entry without 'operation': " + entry);
                continue;
            }
            String statusLabel = entry.path("status").asText("completed");
            try {
                requires.add(new Prerequisite(operation, OperationStatus.fromLabel(statusLabel),
                        entry.path("optional").asBoolean(false)));
            } catch (IllegalArgumentException e) {
                problems.add("requires." + operation + " has unknown status '" + statusLabel + "'");
            }
        }
        return requires;
    }

    private static Map<String, ParameterSpec> parameters(JsonNode node, List<String> problems) {
        Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        if (node.isArray()) {
            for (JsonNode entry : node) {
                String name = text(entry, "name");
                if (name == null) {
                    problems.add("parameter without a name: " + entry);
                } else {
                    parameters.put(name, parameter(name, entry, problems));
                }
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                parameters.put(field.getKey(), parameter(field.getKey(), field.getValue(), problems));
            }
        }
        return parameters;
    }

    private static ParameterSpec parameter(String name, JsonNode node, List<String> problems) {
        String typeLabel = text(node, "type");
        ParameterType type = ParameterType.fromLabel(typeLabel).orElse(null);
        if (type == null) {
            problems.add("parameter '" + name + "' has unknown type '" + typeLabel + "'");
            type = ParameterType.STRING;
        }
        JsonNode defaultValue = node.get("default");
        return new ParameterSpec(name, type, node.path("required").asBoolean(false),
                defaultValue == null || defaultValue.isNull() ? null : defaultValue,
                text(node, "from_config"), text(node, "description"));
    }

    // ==================== Helpers ====================

    /** Capability from the document, else from the {@code <capability>/operations/<file>} layout. */
    private static String capability(JsonNode op, Path source) {
        String declared = text(op, "capability");
        if (declared != null || source == null) {
            return declared;
        }
        Path parent = source.toAbsolutePath().getParent();
        if (parent != null && parent.getFileName() != null
                && parent.getFileName().toString().equals("operations") && parent.getParent() != null) {
            return parent.getParent().getFileName().toString();
        }
        return null;
    }

    static JsonNode readTree(String content, Path source) {
        boolean json = source != null && source.toString().toLowerCase(Locale.ROOT).endsWith(".json");
        try {
            JsonNode root = (json ? JSON : YAML).readTree(content);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new ValidationException("Empty document: " + describe(source));
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Unparsable document " + describe(source) + ": " + e.getOriginalMessage());
        }
    }

    private static Duration seconds(JsonNode node, Duration fallback) {
        if (node.isNumber()) {
            return Duration.ofMillis(Math.round(node.asDouble() * 1000));
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            try {
                return Duration.ofMillis(Math.round(Double.parseDouble(node.asText().trim()) * 1000));
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String describe(Path source) {
        return source == null ? "<inline>" : source.toString();
    }
}
