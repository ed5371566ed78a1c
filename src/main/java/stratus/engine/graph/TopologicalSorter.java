package stratus.engine.graph;

import stratus.engine.model.DependencyEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kahn's algorithm over dependency edges ({@code from} depends on {@code to}, so {@code to}
 * sorts first). Nodes left over once no zero-in-degree node remains are never forced into
 * the order; they are split into actual cycle members (strongly connected components with more
 * than one node) and nodes merely blocked behind a cycle.
 */
final class TopologicalSorter {

    record Result(List<String> order, Set<String> cycleMembers, Set<String> blocked) {
    }

    private TopologicalSorter() {
    }

    static Result sort(Collection<String> nodes, Collection<DependencyEdge> edges) {
        Set<String> nodeSet = new LinkedHashSet<>(nodes);
        Map<String, Set<String>> dependencies = new HashMap<>();
        Map<String, Set<String>> dependents = new HashMap<>();
        for (String node : nodeSet) {
            dependencies.put(node, new LinkedHashSet<>());
            dependents.put(node, new LinkedHashSet<>());
        }
        for (DependencyEdge edge : edges) {
            if (nodeSet.contains(edge.fromId()) && nodeSet.contains(edge.toId()) && !edge.isSelfLoop()) {
                dependencies.get(edge.fromId()).add(edge.toId());
                dependents.get(edge.toId()).add(edge.fromId());
            }
        }

        Map<String, Integer> remaining = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String node : nodeSet) {
            int count = dependencies.get(node).size();
            remaining.put(node, count);
            if (count == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String dependent : dependents.get(node)) {
                int left = remaining.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent);
                }
            }
        }

        Set<String> residual = new LinkedHashSet<>(nodeSet);
        order.forEach(residual::remove);
        if (residual.isEmpty()) {
            return new Result(order, Set.of(), Set.of());
        }

        Set<String> members = new LinkedHashSet<>();
        for (Set<String> component : new Components(residual, dependencies).find()) {
            if (component.size() > 1) {
                members.addAll(component);
            }
        }
        Set<String> blocked = new LinkedHashSet<>(residual);
        blocked.removeAll(members);
        return new Result(order, members, blocked);
    }

    /**
     * Tarjan's strongly connected components over the residual subgraph.
     */
    private static final class Components {

        private final Set<String> nodes;
        private final Map<String, Set<String>> dependencies;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<Set<String>> components = new ArrayList<>();
        private int counter;

        Components(Set<String> nodes, Map<String, Set<String>> dependencies) {
            this.nodes = nodes;
            this.dependencies = dependencies;
        }

        List<Set<String>> find() {
            for (String node : nodes) {
                if (!index.containsKey(node)) {
                    visit(node);
                }
            }
            return components;
        }

        private void visit(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : dependencies.get(node)) {
                if (!nodes.contains(next)) {
                    continue;
                }
                if (!index.containsKey(next)) {
                    visit(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                Set<String> component = new LinkedHashSet<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                components.add(component);
            }
        }
    }
}
