package stratus.engine.graph;

import java.util.List;
import java.util.Set;

/**
 * Summary of a dependency graph build.
 *
 * @param nodeCount     live resources considered
 * @param edgeCount     edges between live resources after the build
 * @param insertedEdges edges newly inserted by this build
 * @param order         topological order, dependencies first; excludes cycle members
 *                      and anything downstream of them
 * @param cycleMembers  resources on a dependency cycle
 * @param blocked       resources not on a cycle but depending on one
 */
public record GraphBuildResult(int nodeCount, int edgeCount, int insertedEdges, List<String> order,
        Set<String> cycleMembers, Set<String> blocked) {

    public boolean hasCycle() {
        return !cycleMembers.isEmpty();
    }
}
