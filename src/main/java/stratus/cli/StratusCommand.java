package stratus.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import stratus.engine.config.Dependencies;
import stratus.engine.config.EngineConfig;
import stratus.engine.error.EngineException;
import stratus.engine.error.OperationExecutionException;
import stratus.engine.error.ValidationException;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

@Command(
        name = "stratus",
        mixinStandardHelpOptions = true,
        version = "stratus 1.0.0",
        description = "Declarative, resumable cloud deployment engine",
        subcommands = {
                OperationCommand.class,
                CapabilityCommand.class,
                WorkflowCommand.class,
                GraphCommand.class,
                DiscoverCommand.class,
                MetricsCommand.class
        }
)
public final class StratusCommand implements Runnable, AutoCloseable {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_VALIDATION = 2;

    @Option(names = {"--project-root"}, description = "Project root holding capabilities/, workflows/ and state/")
    Path projectRoot;

    @Option(names = {"--db-url"}, description = "JDBC URL of the state store")
    String databaseUrl;

    @Spec
    CommandSpec spec;

    private final Function<EngineConfig, Dependencies> factory;
    private Dependencies dependencies;

    public StratusCommand() {
        this(Dependencies::create);
    }

    public StratusCommand(Function<EngineConfig, Dependencies> factory) {
        this.factory = factory;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    Dependencies deps() {
        if (dependencies == null) {
            EngineConfig config = EngineConfig.fromEnv();
            if (projectRoot != null) {
                config.withProjectRoot(projectRoot);
            }
            if (databaseUrl != null) {
                config.withDatabaseUrl(databaseUrl);
            }
            dependencies = factory.apply(config);
        }
        return dependencies;
    }

    @Override
    public void close() {
        if (dependencies != null) {
            dependencies.close();
            dependencies = null;
        }
    }

    /**
     * Command line with engine exceptions mapped to exit codes.
     */
    public static CommandLine commandLine(StratusCommand root) {
        return new CommandLine(root).setExecutionExceptionHandler(StratusCommand::handleFailure);
    }

    private static int handleFailure(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult)
            throws Exception {
        PrintWriter err = commandLine.getErr();
        if (e instanceof ValidationException) {
            ValidationException validation = (ValidationException) e;
            err.println("Validation failed: " + validation.getMessage());
            validation.problems().forEach(problem -> err.println("  - " + problem));
            err.flush();
            return EXIT_VALIDATION;
        }
        if (e instanceof EngineException) {
            err.println("Error: " + e.getMessage());
            if (e instanceof OperationExecutionException) {
                OperationExecutionException failure = (OperationExecutionException) e;
                if (!failure.outputTail().isEmpty()) {
                    err.println("Last output:");
                    failure.outputTail().forEach(line -> err.println("  | " + line));
                }
            }
            err.flush();
            return EXIT_FAILURE;
        }
        throw e;
    }

    /**
     * {@code key=value} pairs from the command line as user parameters.
     */
    static Map<String, JsonNode> userParameters(Map<String, String> raw) {
        Map<String, JsonNode> params = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((key, value) -> params.put(key, TextNode.valueOf(value)));
        }
        return params;
    }
}
