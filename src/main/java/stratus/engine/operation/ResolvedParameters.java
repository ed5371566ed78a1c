package stratus.engine.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Type-checked parameter values for one operation run.
 */
public final class ResolvedParameters {

    static final String MASK = "******";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * One resolved value.
     */
    public record Value(String name, JsonNode value, ParameterType type, ValueSource source) {

        /** String form used for substitution: scalars as text, objects and arrays as JSON. */
        public String asString() {
            return value.isValueNode() ? value.asText() : value.toString();
        }
    }

    private final Map<String, Value> values;

    ResolvedParameters(Map<String, Value> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ResolvedParameters empty() {
        return new ResolvedParameters(Map.of());
    }

    /**
     * Case-insensitive lookup, so {@code {{VNET_NAME}}} finds parameter {@code vnet_name}.
     */
    public Optional<Value> get(String name) {
        Value exact = values.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (Value value : values.values()) {
            if (value.name().equalsIgnoreCase(name)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public Optional<String> string(String name) {
        return get(name).map(Value::asString);
    }

    public Collection<Value> values() {
        return values.values();
    }

    public int size() {
        return values.size();
    }

    /**
     * JSON snapshot for the operation record, with secrets masked.
     */
    public ObjectNode snapshot() {
        ObjectNode node = MAPPER.createObjectNode();
        for (Value value : values.values()) {
            if (value.type() == ParameterType.SECRET) {
                node.put(value.name(), MASK);
            } else {
                node.set(value.name(), value.value());
            }
        }
        return node;
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
