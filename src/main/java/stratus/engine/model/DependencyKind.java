package stratus.engine.model;

/**
 * Strength of a dependency edge.
 */
public enum DependencyKind {
    /** Target must exist before the source can be created */
    REQUIRED,
    /** Target is used when present */
    OPTIONAL,
    /** Informational link, no ordering implied */
    REFERENCE
}
