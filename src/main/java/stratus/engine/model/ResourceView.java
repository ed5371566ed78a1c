package stratus.engine.model;

/**
 * Query result row: the resource plus whether it is still fresh.
 * Stale rows need rediscovery; they are not absent.
 */
public record ResourceView(Resource resource, boolean fresh) {
}
