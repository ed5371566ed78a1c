package stratus.engine.operation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of an operation's parameter schema.
 *
 * @param defaultValue documented default, null when none
 * @param fromConfig   configuration key to consult when the user supplies nothing
 */
public record ParameterSpec(String name, ParameterType type, boolean required, JsonNode defaultValue,
        String fromConfig, String description) {

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isNull() && !defaultValue.isMissingNode();
    }
}
