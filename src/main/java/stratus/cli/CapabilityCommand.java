package stratus.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import stratus.engine.config.Dependencies;
import stratus.engine.error.ValidationException;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.service.OperationOutcome;
import stratus.engine.service.PipelineOptions;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "capability",
        description = "Run and inspect capability groups",
        subcommands = {
                CapabilityCommand.RunCommand.class,
                CapabilityCommand.ListCommand.class,
                CapabilityCommand.ShowCommand.class
        }
)
final class CapabilityCommand implements Runnable {

    @ParentCommand
    StratusCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static List<OperationDefinition> operations(Dependencies deps, String capability) {
        List<OperationDefinition> operations = deps.operationCatalog().operationsOf(capability);
        if (operations.isEmpty()) {
            throw new ValidationException("Unknown or empty capability: " + capability);
        }
        return operations;
    }

    @Command(name = "run", description = "Run every operation of a capability in file order, stopping at the first failure")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        CapabilityCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Capability name")
        String capability;

        @Option(names = {"--force"}, description = "Bypass idempotency probes and prerequisites")
        boolean force;

        @Option(names = {"--resume"}, description = "Skip operations whose checkpoint is completed")
        boolean resume;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            PrintWriter out = spec.commandLine().getOut();
            List<OperationDefinition> operations = operations(deps, capability);
            PipelineOptions options = new PipelineOptions(force, resume, null);
            int index = 0;
            for (OperationDefinition def : operations) {
                index++;
                out.printf("[%d/%d] %s%n", index, operations.size(), def.id());
                out.flush();
                OperationOutcome outcome = deps.operationPipeline().run(def, Map.of(), options);
                OperationCommand.printOutcome(out, outcome);
            }
            out.println("Capability " + capability + ": " + operations.size() + " operation(s) done");
            out.flush();
            return StratusCommand.EXIT_OK;
        }
    }

    @Command(name = "list", description = "List capabilities")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        CapabilityCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            PrintWriter out = spec.commandLine().getOut();
            for (String capability : deps.operationCatalog().capabilities()) {
                out.printf("%-30s %d operation(s)%n", capability, deps.operationCatalog().operationsOf(capability).size());
            }
            out.flush();
            return StratusCommand.EXIT_OK;
        }
    }

    @Command(name = "show", description = "Show the operations of a capability")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        CapabilityCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Capability name")
        String capability;

        @Override
        public Integer call() {
            Dependencies deps = parent.root.deps();
            PrintWriter out = spec.commandLine().getOut();
            out.println("Capability: " + capability);
            for (OperationDefinition def : operations(deps, capability)) {
                String checkpoint = deps.checkpointStore().find(def.id())
                        .map(c -> c.status().label())
                        .orElse("-");
                out.printf("  %-40s %-10s %s%n", def.id(), checkpoint, def.name());
            }
            out.flush();
            return StratusCommand.EXIT_OK;
        }
    }
}
