package stratus.engine.operation;

import stratus.engine.model.OperationStatus;

/**
 * Another operation that must have reached a status before this one runs.
 * A bare id in a definition means {@code {operation: id, status: completed, optional: false}}.
 */
public record Prerequisite(String operation, OperationStatus status, boolean optional) {

    public static Prerequisite required(String operation) {
        return new Prerequisite(operation, OperationStatus.COMPLETED, false);
    }
}
