package stratus.engine.error;

/**
 * Base type for every failure raised by the deployment engine.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
