package stratus.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import stratus.engine.error.ValidationException;
import stratus.engine.workflow.ExecutionStatus;
import stratus.engine.workflow.StepState;
import stratus.engine.workflow.WorkflowDefinition;
import stratus.engine.workflow.WorkflowExecution;
import stratus.engine.workflow.WorkflowOrchestrator;
import stratus.engine.workflow.WorkflowRunOptions;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "workflow",
        description = "Run, resume, validate and inspect workflows",
        subcommands = {
                WorkflowCommand.RunCommand.class,
                WorkflowCommand.ResumeCommand.class,
                WorkflowCommand.ValidateCommand.class,
                WorkflowCommand.ListCommand.class,
                WorkflowCommand.ShowCommand.class
        }
)
final class WorkflowCommand implements Runnable {

    @ParentCommand
    StratusCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static int report(PrintWriter out, WorkflowExecution execution) {
        out.printf("Execution %s: %s (%d/%d steps completed)%n", execution.executionId(),
                execution.status().label(), execution.completedCount(), execution.totalSteps());
        for (StepState step : execution.steps().values()) {
            out.printf("  [%d] %-30s %-10s %s%n", step.index(), step.name(), step.status().label(),
                    step.output() == null ? "" : firstLine(step.output()));
        }
        if (!execution.failedSteps().isEmpty()) {
            out.println("Failed steps: " + execution.failedSteps());
        }
        if (execution.error() != null) {
            out.println("Error: " + execution.error());
        }
        out.flush();
        return execution.status() == ExecutionStatus.COMPLETED ? StratusCommand.EXIT_OK : StratusCommand.EXIT_FAILURE;
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline) + " ...";
    }

    @Command(name = "run", description = "Run a workflow file")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        WorkflowCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Workflow file")
        Path file;

        @Option(names = {"--force"}, description = "Bypass idempotency probes and prerequisites")
        boolean force;

        @Option(names = {"--resume"}, description = "Skip steps whose operation checkpoint is completed")
        boolean resume;

        @Option(names = {"--step"}, description = "Only run this 1-based step (repeatable)")
        Set<Integer> steps;

        @Override
        public Integer call() {
            WorkflowOrchestrator orchestrator = parent.root.deps().workflowOrchestrator();
            WorkflowDefinition workflow = orchestrator.load(file);
            orchestrator.validate(workflow);
            WorkflowExecution execution = orchestrator.execute(workflow, new WorkflowRunOptions(force, resume, steps));
            return report(spec.commandLine().getOut(), execution);
        }
    }

    @Command(name = "resume", description = "Resume a stored execution in place")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        WorkflowCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Override
        public Integer call() {
            WorkflowExecution execution = parent.root.deps().workflowOrchestrator().resume(executionId);
            return report(spec.commandLine().getOut(), execution);
        }
    }

    @Command(name = "validate", description = "Statically validate a workflow file")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        WorkflowCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Workflow file")
        Path file;

        @Override
        public Integer call() {
            WorkflowOrchestrator orchestrator = parent.root.deps().workflowOrchestrator();
            PrintWriter out = spec.commandLine().getOut();
            List<String> problems = orchestrator.problems(orchestrator.load(file));
            if (problems.isEmpty()) {
                out.println(file + ": valid");
                out.flush();
                return StratusCommand.EXIT_OK;
            }
            out.println(file + ": " + problems.size() + " problem(s)");
            problems.forEach(p -> out.println("  - " + p));
            out.flush();
            return StratusCommand.EXIT_VALIDATION;
        }
    }

    @Command(name = "list", description = "List stored executions, newest first")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        WorkflowCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            for (WorkflowExecution execution : parent.root.deps().workflowOrchestrator().listExecutions()) {
                out.printf("%-50s %-30s %-10s %s%n", execution.executionId(), execution.workflowId(),
                        execution.status().label(), execution.startedAt());
            }
            out.flush();
            return StratusCommand.EXIT_OK;
        }
    }

    @Command(name = "show", description = "Show one execution")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        WorkflowCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Override
        public Integer call() {
            WorkflowExecution execution = parent.root.deps().workflowOrchestrator().getStatus(executionId)
                    .orElseThrow(() -> new ValidationException("Unknown execution: " + executionId));
            report(spec.commandLine().getOut(), execution);
            return StratusCommand.EXIT_OK;
        }
    }
}
