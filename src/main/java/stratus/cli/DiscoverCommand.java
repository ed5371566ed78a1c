package stratus.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import stratus.engine.graph.GraphBuildResult;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "discover", description = "Discover resources in a scope and rebuild the dependency graph")
final class DiscoverCommand implements Callable<Integer> {

    @ParentCommand
    StratusCommand root;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Scope (resource group)")
    String scope;

    @Option(names = {"--refresh-stale"}, description = "Also re-fetch stale resources afterwards")
    boolean refreshStale;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        GraphBuildResult result = root.deps().discoveryService().discover(scope);
        out.printf("Scope %s: %d resources, %d dependency edges%n", scope, result.nodeCount(), result.edgeCount());
        if (result.hasCycle()) {
            out.println("Warning: dependency cycle among " + result.cycleMembers());
        }
        if (refreshStale) {
            out.println("Refreshed " + root.deps().discoveryService().refreshStale() + " stale resource(s)");
        }
        out.flush();
        return StratusCommand.EXIT_OK;
    }
}
