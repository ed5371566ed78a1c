package stratus.engine.model;

import java.util.Objects;

/**
 * Directed edge: {@code fromId} depends on {@code toId}.
 */
public record DependencyEdge(String fromId, String toId, DependencyKind kind, Relationship relationship) {

    public DependencyEdge {
        Objects.requireNonNull(fromId, "fromId is required");
        Objects.requireNonNull(toId, "toId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(relationship, "relationship is required");
    }

    public boolean isSelfLoop() {
        return fromId.equalsIgnoreCase(toId);
    }
}
