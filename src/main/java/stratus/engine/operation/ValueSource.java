package stratus.engine.operation;

/**
 * Where a resolved parameter value came from, highest priority first.
 */
public enum ValueSource {
    /** Supplied by the caller */
    USER,
    /** Looked up through the parameter's config mapping */
    CONFIG,
    /** Schema default */
    DEFAULT
}
