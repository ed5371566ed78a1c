package stratus.engine.model;

/**
 * Filters for resource queries. Null fields match everything.
 */
public record ResourceFilter(String type, String scope, String name, Boolean managed, boolean includeDeleted) {

    public static ResourceFilter all() {
        return new ResourceFilter(null, null, null, null, false);
    }

    public static ResourceFilter byType(String type) {
        return new ResourceFilter(type, null, null, null, false);
    }

    public ResourceFilter inScope(String scope) {
        return new ResourceFilter(type, scope, name, managed, includeDeleted);
    }

    public ResourceFilter named(String name) {
        return new ResourceFilter(type, scope, name, managed, includeDeleted);
    }

    public ResourceFilter managedOnly() {
        return new ResourceFilter(type, scope, name, Boolean.TRUE, includeDeleted);
    }

    public ResourceFilter withDeleted() {
        return new ResourceFilter(type, scope, name, managed, true);
    }
}
