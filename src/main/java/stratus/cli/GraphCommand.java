package stratus.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import stratus.engine.error.EngineException;
import stratus.engine.graph.DependencyGraphBuilder;
import stratus.engine.graph.GraphBuildResult;
import stratus.engine.graph.GraphExporter;
import stratus.engine.store.JsonFiles;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

@Command(
        name = "graph",
        description = "Build and export the resource dependency graph",
        subcommands = {
                GraphCommand.BuildCommand.class,
                GraphCommand.ExportCommand.class
        }
)
final class GraphCommand implements Runnable {

    enum Format { json, dot }

    @ParentCommand
    StratusCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "build", description = "Re-detect edges over all live resources and report the order")
    static final class BuildCommand implements Callable<Integer> {
        @ParentCommand
        GraphCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            GraphBuildResult result = parent.root.deps().graphBuilder().build();
            out.printf("Nodes: %d, edges: %d (%d new)%n", result.nodeCount(), result.edgeCount(), result.insertedEdges());
            if (result.hasCycle()) {
                out.println("Cycle detected among: " + result.cycleMembers());
                if (!result.blocked().isEmpty()) {
                    out.println("Blocked behind the cycle: " + result.blocked());
                }
                out.flush();
                return StratusCommand.EXIT_FAILURE;
            }
            int position = 0;
            for (String id : result.order()) {
                out.printf("%4d  %s%n", ++position, id);
            }
            out.flush();
            return StratusCommand.EXIT_OK;
        }
    }

    @Command(name = "export", description = "Export the graph as JSON or DOT")
    static final class ExportCommand implements Callable<Integer> {
        @ParentCommand
        GraphCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--format"}, defaultValue = "json", description = "json or dot")
        Format format;

        @Option(names = {"-o", "--output"}, description = "Write to this file instead of stdout")
        Path output;

        @Override
        public Integer call() throws IOException {
            DependencyGraphBuilder.GraphSnapshot snapshot = parent.root.deps().graphBuilder().snapshot();
            String document = format == Format.dot
                    ? GraphExporter.toDot(snapshot)
                    : JsonFiles.mapper().writeValueAsString(GraphExporter.toJson(snapshot, Instant.now()));
            if (output == null) {
                PrintWriter out = spec.commandLine().getOut();
                out.println(document);
                out.flush();
            } else {
                try {
                    Files.writeString(output, document, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new EngineException("Cannot write " + output + ": " + e.getMessage(), e);
                }
                spec.commandLine().getOut().println("Graph written to " + output);
                spec.commandLine().getOut().flush();
            }
            return StratusCommand.EXIT_OK;
        }
    }
}
