package stratus.engine.client;

/**
 * One poll of the dispatcher.
 *
 * @param output remote output collected so far, may be empty while running
 */
public record RemoteStatus(RemoteExecutionState state, String output, Integer exitCode) {
}
