package stratus.engine.operation;

/**
 * Post-execution check. A check with a command must exit 0 (and contain {@code expect} when
 * set); checks without a command are recorded as requiring remote validation.
 */
public record PostCheck(String type, String description, String command, String expect) {

    public boolean executable() {
        return command != null && !command.isBlank();
    }
}
