package stratus;

import stratus.cli.StratusCommand;

/**
 * Command-line entry point.
 */
public final class App {

    private App() {
    }

    public static void main(String[] args) {
        int exitCode;
        try (StratusCommand root = new StratusCommand()) {
            exitCode = StratusCommand.commandLine(root).execute(args);
        }
        System.exit(exitCode);
    }
}
