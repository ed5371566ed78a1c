package stratus.engine.error;

/**
 * Storage I/O failure. Callers may retry the whole transaction a bounded number of times.
 */
public class StorageException extends EngineException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
