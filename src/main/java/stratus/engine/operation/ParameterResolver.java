package stratus.engine.operation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import stratus.engine.config.ConfigProvider;
import stratus.engine.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves an operation's parameters: user value, else config-mapped value, else schema default.
 * Every value is coerced to its declared type. Missing required values and type mismatches are
 * collected and raised as one {@link ValidationException}, before anything is rendered or run.
 */
public class ParameterResolver {

    private static final Logger log = LoggerFactory.getLogger(ParameterResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConfigProvider config;

    public ParameterResolver(ConfigProvider config) {
        this.config = config;
    }

    public ResolvedParameters resolve(OperationDefinition definition, Map<String, JsonNode> userParams) {
        return resolve(definition.id(), definition.parameters(), userParams);
    }

    public ResolvedParameters resolve(String operationId, Map<String, ParameterSpec> schema,
            Map<String, JsonNode> userParams) {
        Map<String, JsonNode> user = userParams != null ? userParams : Map.of();
        Map<String, ResolvedParameters.Value> resolved = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();

        for (ParameterSpec spec : schema.values()) {
            JsonNode raw = null;
            ValueSource source = null;

            Optional<JsonNode> supplied = lookup(user, spec.name());
            if (supplied.isPresent()) {
                raw = supplied.get();
                source = ValueSource.USER;
            } else if (spec.fromConfig() != null) {
                Optional<String> fromConfig = config.get(spec.fromConfig());
                if (fromConfig.isPresent()) {
                    raw = TextNode.valueOf(fromConfig.get());
                    source = ValueSource.CONFIG;
                }
            }
            if (raw == null && spec.hasDefault()) {
                raw = spec.defaultValue();
                source = ValueSource.DEFAULT;
            }

            if (raw == null) {
                if (spec.required()) {
                    problems.add("parameter '" + spec.name() + "' is required but has no value"
                            + (spec.fromConfig() != null ? " (config key " + spec.fromConfig() + " is unset)" : ""));
                }
                continue;
            }

            try {
                resolved.put(spec.name(), new ResolvedParameters.Value(spec.name(), coerce(raw, spec.type()),
                        spec.type(), source));
            } catch (IllegalArgumentException e) {
                problems.add("parameter '" + spec.name() + "' expected " + spec.type().label() + ": "
                        + e.getMessage());
            }
        }

        // Literal parameters outside the schema pass through as given.
        for (Map.Entry<String, JsonNode> entry : user.entrySet()) {
            boolean declared = schema.keySet().stream().anyMatch(k -> k.equalsIgnoreCase(entry.getKey()));
            if (!declared && entry.getValue() != null && !entry.getValue().isNull()) {
                JsonNode value = entry.getValue();
                ParameterType type = value.isObject() ? ParameterType.OBJECT
                        : value.isArray() ? ParameterType.ARRAY : ParameterType.STRING;
                resolved.put(entry.getKey(),
                        new ResolvedParameters.Value(entry.getKey(), value, type, ValueSource.USER));
            }
        }

        if (!problems.isEmpty()) {
            throw new ValidationException("Parameter resolution failed for " + operationId, problems);
        }

        log.debug("Resolved {} parameters for {}", resolved.size(), operationId);
        return new ResolvedParameters(resolved);
    }

    /**
     * Coerce a raw value to the declared type.
     *
     * @throws IllegalArgumentException describing the mismatch
     */
    static JsonNode coerce(JsonNode raw, ParameterType type) {
        return switch (type) {
            case STRING, SECRET -> {
                if (raw.isContainerNode()) {
                    throw new IllegalArgumentException("got " + kind(raw));
                }
                yield raw.isTextual() ? raw : TextNode.valueOf(raw.asText());
            }
            case BOOL -> {
                if (raw.isBoolean()) {
                    yield raw;
                }
                if (raw.isTextual()) {
                    String text = raw.asText().trim().toLowerCase(Locale.ROOT);
                    if (text.equals("true") || text.equals("yes")) {
                        yield BooleanNode.TRUE;
                    }
                    if (text.equals("false") || text.equals("no")) {
                        yield BooleanNode.FALSE;
                    }
                }
                throw new IllegalArgumentException("got " + kind(raw) + " '" + raw.asText() + "'");
            }
            case NUMBER -> {
                if (raw.isNumber()) {
                    yield raw;
                }
                if (raw.isTextual()) {
                    try {
                        BigDecimal number = new BigDecimal(raw.asText().trim());
                        yield number.scale() <= 0 && number.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0
                                ? LongNode.valueOf(number.longValueExact())
                                : DecimalNode.valueOf(number);
                    } catch (NumberFormatException | ArithmeticException e) {
                        throw new IllegalArgumentException("got text '" + raw.asText() + "'");
                    }
                }
                throw new IllegalArgumentException("got " + kind(raw));
            }
            case OBJECT -> {
                JsonNode node = raw.isTextual() ? parseJson(raw.asText()) : raw;
                if (node == null || !node.isObject()) {
                    throw new IllegalArgumentException("got " + kind(raw));
                }
                yield node;
            }
            case ARRAY -> {
                JsonNode node = raw.isTextual() ? parseJson(raw.asText()) : raw;
                if (node == null || !node.isArray()) {
                    throw new IllegalArgumentException("got " + kind(raw));
                }
                yield node;
            }
        };
    }

    private static Optional<JsonNode> lookup(Map<String, JsonNode> user, String name) {
        JsonNode exact = user.get(name);
        if (exact != null && !exact.isNull()) {
            return Optional.of(exact);
        }
        for (Map.Entry<String, JsonNode> entry : user.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && entry.getValue() != null && !entry.getValue().isNull()) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private static JsonNode parseJson(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String kind(JsonNode node) {
        if (node.isObject()) {
            return "object";
        } else if (node.isArray()) {
            return "array";
        } else if (node.isBoolean()) {
            return "bool";
        } else if (node.isNumber()) {
            return "number";
        }
        return "text";
    }
}
