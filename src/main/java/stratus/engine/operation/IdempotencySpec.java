package stratus.engine.operation;

/**
 * Probe that tells whether the operation's target is already in the desired state.
 */
public record IdempotencySpec(boolean enabled, String checkCommand, boolean skipIfExists) {

    public static IdempotencySpec none() {
        return new IdempotencySpec(false, null, false);
    }

    public boolean declared() {
        return enabled && checkCommand != null && !checkCommand.isBlank();
    }
}
