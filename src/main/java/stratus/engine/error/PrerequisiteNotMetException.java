package stratus.engine.error;

/**
 * A required prerequisite operation has not reached the expected status.
 */
public class PrerequisiteNotMetException extends EngineException {

    private final String operationId;
    private final String prerequisite;

    public PrerequisiteNotMetException(String operationId, String prerequisite, String expectedStatus,
            String actualStatus) {
        super("Operation " + operationId + " requires " + prerequisite + " to be " + expectedStatus
                + " (current: " + (actualStatus == null ? "never run" : actualStatus) + ")");
        this.operationId = operationId;
        this.prerequisite = prerequisite;
    }

    public String operationId() {
        return operationId;
    }

    public String prerequisite() {
        return prerequisite;
    }
}
