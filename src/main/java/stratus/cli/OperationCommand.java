package stratus.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import stratus.engine.config.Dependencies;
import stratus.engine.error.ValidationException;
import stratus.engine.model.OperationLogEntry;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.operation.ParameterSpec;
import stratus.engine.service.OperationOutcome;
import stratus.engine.service.PipelineOptions;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "operation",
        description = "Run, resume, validate and inspect single operations",
        subcommands = {
                OperationCommand.RunCommand.class,
                OperationCommand.ResumeCommand.class,
                OperationCommand.ValidateCommand.class,
                OperationCommand.ListCommand.class,
                OperationCommand.ShowCommand.class
        }
)
final class OperationCommand implements Runnable {

    @ParentCommand
    StratusCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static OperationDefinition find(Dependencies deps, String operationId) {
        return deps.operationCatalog().findById(operationId)
                .orElseThrow(() -> new ValidationException("Unknown operation: " + operationId));
    }

    static void printOutcome(PrintWriter out, OperationOutcome outcome) {
        if (outcome.skipped()) {
            out.printf("%s skipped: %s (record %s)%n", outcome.operationId(), outcome.reason(), outcome.recordId());
        } else {
            out.printf("%s %s in %ds (record %s)%s%n", outcome.operationId(), outcome.status().label(),
                    outcome.elapsed().toSeconds(), outcome.recordId(),
                    outcome.suspicious() ? " [suspicious: no [SUCCESS] marker]" : "");
        }
        out.flush();
    }

    @Command(name = "run", description = "Run an operation")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        OperationCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Operation id")
        String operationId;

        @Option(names = {"-p", "--param"}, description = "Parameter as key=value")
        Map<String, String> params;

        @Option(names = {"--force"}, description = "Bypass idempotency probe and prerequisites")
        boolean force;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            OperationOutcome outcome = deps.operationPipeline().run(operationId,
                    StratusCommand.userParameters(params), new PipelineOptions(force, false, null));
            printOutcome(spec.commandLine().getOut(), outcome);
            return StratusCommand.EXIT_OK;
        }
    }

    @Command(name = "resume", description = "Run an operation unless its checkpoint is completed")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        OperationCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Operation id")
        String operationId;

        @Option(names = {"-p", "--param"}, description = "Parameter as key=value")
        Map<String, String> params;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            OperationOutcome outcome = deps.operationPipeline().run(operationId,
                    StratusCommand.userParameters(params), new PipelineOptions(false, true, null));
            printOutcome(spec.commandLine().getOut(), outcome);
            return StratusCommand.EXIT_OK;
        }
    }

    @Command(name = "validate", description = "Statically validate an operation definition")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        OperationCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Operation id")
        String operationId;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            PrintWriter out = spec.commandLine().getOut();
            List<String> problems = deps.definitionValidator().problems(find(deps, operationId));
            if (problems.isEmpty()) {
                out.println(operationId + ": valid");
                out.flush();
                return StratusCommand.EXIT_OK;
            }
            out.println(operationId + ": " + problems.size() + " problem(s)");
            problems.forEach(p -> out.println("  - " + p));
            out.flush();
            return StratusCommand.EXIT_VALIDATION;
        }
    }

    @Command(name = "list", description = "List known operations")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        OperationCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--capability"}, description = "Only operations of this capability")
        String capability;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            PrintWriter out = spec.commandLine().getOut();
            List<OperationDefinition> definitions = capability == null
                    ? deps.operationCatalog().all()
                    : deps.operationCatalog().operationsOf(capability);
            for (OperationDefinition def : definitions) {
                out.printf("%-40s %-20s %-10s %s%n", def.id(), def.capability(),
                        def.modeLabel() == null ? "create" : def.modeLabel(), def.duration().category());
            }
            out.flush();
            return StratusCommand.EXIT_OK;
        }
    }

    @Command(name = "show", description = "Show an operation definition and its last run")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        OperationCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Operation id")
        String operationId;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            PrintWriter out = spec.commandLine().getOut();
            OperationDefinition def = find(deps, operationId);
            out.println("Operation:   " + def.id());
            out.println("Name:        " + def.name());
            out.println("Capability:  " + def.capability());
            out.println("Mode:        " + (def.modeLabel() == null ? "create" : def.modeLabel()));
            out.println("Duration:    expected " + def.duration().expected().toSeconds() + "s, timeout "
                    + def.duration().timeout().toSeconds() + "s, " + def.duration().category());
            out.println("Template:    " + def.template().type().label());
            out.println("Source:      " + def.source());
            if (!def.parameters().isEmpty()) {
                out.println("Parameters:");
                for (ParameterSpec p : def.parameters().values()) {
                    out.printf("  %-28s %-8s %s%n", p.name(), p.type().label(), p.required() ? "required" : "optional");
                }
            }
            if (!def.requires().isEmpty()) {
                out.println("Requires:");
                def.requires().forEach(r -> out.println("  " + r.operation() + " = " + r.status().label()
                        + (r.optional() ? " (optional)" : "")));
            }
            deps.checkpointStore().find(operationId).ifPresent(c -> out.println("Checkpoint:  "
                    + c.status().label() + " at " + c.timestamp() + " (" + c.durationSeconds() + "s)"));
            deps.operationRepository().findLatestByOperationId(operationId).ifPresent(record -> {
                out.println("Last run:    " + record.id() + " " + record.status().label()
                        + (record.errorMessage() != null ? " - " + record.errorMessage() : ""));
                for (OperationLogEntry entry : deps.operationRepository().findLogs(record.id())) {
                    out.printf("  %s %-5s %s%n", entry.loggedAt(), entry.level(), entry.message());
                }
            });
            out.flush();
            return StratusCommand.EXIT_OK;
        }
    }
}
