package stratus.engine.operation;

import stratus.engine.model.OperationCategory;

import java.time.Duration;

/**
 * Fully substituted command ready for supervision. Contains no {@code {{TOKEN}}} placeholders.
 *
 * @param staleAfter heartbeat staleness override, null for the configured default
 */
public record RenderedCommand(String operationId, TemplateType type, String command, String vmName,
        String resourceGroup, OperationCategory category, Duration expected, Duration timeout, Duration staleAfter) {
}
