package stratus.engine.error;

import java.util.List;

/**
 * Supervised work exited nonzero or emitted an {@code [ERROR]} marker.
 * Carries the tail of the captured output.
 */
public class OperationExecutionException extends EngineException {

    private final Integer exitCode;
    private final List<String> outputTail;

    public OperationExecutionException(String message, Integer exitCode, List<String> outputTail) {
        super(message);
        this.exitCode = exitCode;
        this.outputTail = outputTail == null ? List.of() : List.copyOf(outputTail);
    }

    public Integer exitCode() {
        return exitCode;
    }

    public List<String> outputTail() {
        return outputTail;
    }
}
