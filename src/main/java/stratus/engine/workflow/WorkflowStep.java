package stratus.engine.workflow;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * One step of a workflow.
 *
 * @param index      1-based position in the workflow
 * @param operation  operation reference: a file path or a catalog operation id
 * @param parameters literal parameters passed as user values
 */
public record WorkflowStep(int index, String name, String operation, Map<String, JsonNode> parameters,
        boolean continueOnError) {

    public WorkflowStep {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
