package stratus.engine.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import stratus.engine.model.DependencyEdge;
import stratus.engine.model.Resource;

import java.time.Instant;
import java.util.Locale;

/**
 * Renders a graph snapshot as a generic node/edge JSON document or as Graphviz DOT text.
 */
public final class GraphExporter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphExporter() {
    }

    public static ObjectNode toJson(DependencyGraphBuilder.GraphSnapshot graph, Instant generatedAt) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode metadata = root.putObject("metadata");
        metadata.put("generated_at", generatedAt.toString());
        metadata.put("total_resources", graph.resources().size());
        metadata.put("total_dependencies", graph.edges().size());

        ArrayNode nodes = root.putArray("nodes");
        for (Resource resource : graph.resources()) {
            nodes.addObject()
                    .put("id", resource.id())
                    .put("name", resource.name())
                    .put("type", resource.type());
        }

        ArrayNode edges = root.putArray("edges");
        for (DependencyEdge edge : graph.edges()) {
            edges.addObject()
                    .put("from", edge.fromId())
                    .put("to", edge.toId())
                    .put("type", edge.kind().name().toLowerCase(Locale.ROOT))
                    .put("relationship", edge.relationship().label());
        }
        return root;
    }

    public static String toDot(DependencyGraphBuilder.GraphSnapshot graph) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ResourceDependencies {\n");
        dot.append("    rankdir=TB;\n");
        dot.append("    node [shape=box, style=filled, fontname=\"Arial\", fillcolor=lightblue];\n");
        dot.append("    edge [fontname=\"Arial\", fontsize=10];\n\n");

        for (Resource resource : graph.resources()) {
            dot.append("    \"").append(escape(resource.id())).append("\" [label=\"")
                    .append(escape(resource.name())).append("\\n(").append(escape(resource.type()))
                    .append(")\", fillcolor=").append(fillColor(resource.type())).append("];\n");
        }
        dot.append('\n');

        for (DependencyEdge edge : graph.edges()) {
            String style;
            String color;
            switch (edge.kind()) {
                case REQUIRED -> {
                    style = "solid";
                    color = "red";
                }
                case OPTIONAL -> {
                    style = "dashed";
                    color = "blue";
                }
                case REFERENCE -> {
                    style = "dotted";
                    color = "gray";
                }
                default -> throw new IllegalStateException("Unhandled kind: " + edge.kind());
            }
            dot.append("    \"").append(escape(edge.fromId())).append("\" -> \"").append(escape(edge.toId()))
                    .append("\" [label=\"").append(edge.relationship().label()).append("\", style=")
                    .append(style).append(", color=").append(color).append("];\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String fillColor(String type) {
        String t = type.toLowerCase(Locale.ROOT);
        if (t.equals("microsoft.compute/virtualmachines")) {
            return "lightcoral";
        } else if (t.startsWith("microsoft.network/")) {
            return "lightgreen";
        } else if (t.startsWith("microsoft.storage/")) {
            return "lightyellow";
        } else if (t.startsWith("microsoft.desktopvirtualization/")) {
            return "lightpink";
        }
        return "lightblue";
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
