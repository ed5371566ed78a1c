package stratus.engine.graph;

import stratus.engine.model.DependencyEdge;
import stratus.engine.model.Resource;
import stratus.engine.model.ResourceFilter;
import stratus.engine.model.ResourceView;
import stratus.engine.repository.DependencyRepository;
import stratus.engine.repository.ResourceRepository;
import stratus.engine.store.StorageRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the resource dependency graph from the state store.
 * The graph is advisory: it informs callers about ordering, it never schedules anything.
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final ResourceRepository resources;
    private final DependencyRepository dependencies;
    private final DependencyDetector detector;
    private final StorageRetry retry;

    public DependencyGraphBuilder(ResourceRepository resources, DependencyRepository dependencies,
            DependencyDetector detector, StorageRetry retry) {
        this.resources = resources;
        this.dependencies = dependencies;
        this.detector = detector;
        this.retry = retry;
    }

    /**
     * Detect edges for a single resource without storing them.
     */
    public List<DependencyEdge> detect(Resource resource) {
        return detector.detect(resource);
    }

    /**
     * Re-run detection over every live resource, insert edges idempotently and
     * compute a topological order. A cycle is reported, never silently ordered.
     */
    public GraphBuildResult build() {
        List<Resource> live = liveResources();

        List<DependencyEdge> detected = new ArrayList<>();
        for (Resource resource : live) {
            detected.addAll(detector.detect(resource));
        }
        int inserted = retry.call("Insert dependency edges", () -> dependencies.addAll(detected));

        Set<String> ids = ids(live);
        List<DependencyEdge> edges = liveEdges(ids);
        TopologicalSorter.Result sorted = TopologicalSorter.sort(ids, edges);

        if (!sorted.cycleMembers().isEmpty()) {
            log.warn("Dependency cycle detected among {} resources: {}", sorted.cycleMembers().size(),
                    sorted.cycleMembers());
        }
        log.info("Dependency graph built: {} resources, {} edges ({} new)", ids.size(), edges.size(), inserted);

        return new GraphBuildResult(ids.size(), edges.size(), inserted, sorted.order(),
                sorted.cycleMembers(), sorted.blocked());
    }

    /**
     * Live resources with no outgoing dependencies.
     */
    public List<String> rootResources() {
        Set<String> ids = ids(liveResources());
        Set<String> withDependencies = new HashSet<>();
        for (DependencyEdge edge : liveEdges(ids)) {
            withDependencies.add(edge.fromId());
        }
        List<String> roots = new ArrayList<>(ids);
        roots.removeAll(withDependencies);
        return roots;
    }

    /**
     * Live resources nothing else depends on.
     */
    public List<String> leafResources() {
        Set<String> ids = ids(liveResources());
        Set<String> depended = new HashSet<>();
        for (DependencyEdge edge : liveEdges(ids)) {
            depended.add(edge.toId());
        }
        List<String> leaves = new ArrayList<>(ids);
        leaves.removeAll(depended);
        return leaves;
    }

    /**
     * Transitive dependencies of a resource, breadth first, keyed by id with their depth.
     */
    public Map<String, Integer> dependencyTree(String resourceId, int maxDepth) {
        Map<String, Integer> visited = new LinkedHashMap<>();
        List<String> frontier = List.of(resourceId);
        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            List<String> next = new ArrayList<>();
            for (String id : frontier) {
                for (DependencyEdge edge : dependencies.findDependencies(id)) {
                    if (!edge.toId().equals(resourceId) && visited.putIfAbsent(edge.toId(), depth) == null) {
                        next.add(edge.toId());
                    }
                }
            }
            frontier = next;
        }
        return visited;
    }

    /**
     * Live resources and the stored edges between them, for export.
     */
    public GraphSnapshot snapshot() {
        List<Resource> live = liveResources();
        return new GraphSnapshot(live, liveEdges(ids(live)));
    }

    private List<Resource> liveResources() {
        List<Resource> live = new ArrayList<>();
        for (ResourceView view : resources.query(ResourceFilter.all())) {
            live.add(view.resource());
        }
        return live;
    }

    private List<DependencyEdge> liveEdges(Set<String> ids) {
        List<DependencyEdge> edges = new ArrayList<>();
        for (DependencyEdge edge : dependencies.findAll()) {
            if (ids.contains(edge.fromId()) && ids.contains(edge.toId())) {
                edges.add(edge);
            }
        }
        return edges;
    }

    private static Set<String> ids(List<Resource> resources) {
        Set<String> ids = new LinkedHashSet<>();
        for (Resource resource : resources) {
            ids.add(resource.id());
        }
        return ids;
    }

    /**
     * Point-in-time view of the graph.
     */
    public record GraphSnapshot(List<Resource> resources, List<DependencyEdge> edges) {
    }
}
