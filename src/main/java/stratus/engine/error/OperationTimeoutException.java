package stratus.engine.error;

import java.time.Duration;

/**
 * Supervised work exceeded its declared timeout and was cancelled.
 */
public class OperationTimeoutException extends EngineException {

    private final Duration timeout;

    public OperationTimeoutException(String operationId, Duration timeout) {
        super("Operation " + operationId + " timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
