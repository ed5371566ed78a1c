package stratus.engine.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model of an external infrastructure object tracked by the state store.
 * Resources are created or refreshed by discovery or by operation execution, and are never
 * hard-deleted.
 */
public final class Resource {
    private final String id;
    private final String type;
    private final String name;
    private final String scope; // resource group
    private final String subscriptionId;
    private final String location;
    private final String provisioningState;
    private final String properties; // JSON property bag
    private final Map<String, String> tags;
    private final boolean managed;
    private final Instant adoptedAt;
    private final Instant createdAt;
    private final Instant lastRefreshed;
    private final Instant invalidatedAt;
    private final Instant deletedAt;

    private Resource(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.name = builder.name != null ? builder.name : nameFromId(builder.id);
        this.scope = builder.scope;
        this.subscriptionId = builder.subscriptionId;
        this.location = builder.location;
        this.provisioningState = builder.provisioningState;
        this.properties = builder.properties != null ? builder.properties : "{}";
        this.tags = builder.tags != null ? Map.copyOf(builder.tags) : Map.of();
        this.managed = builder.managed;
        this.adoptedAt = builder.adoptedAt;
        this.createdAt = builder.createdAt;
        this.lastRefreshed = builder.lastRefreshed;
        this.invalidatedAt = builder.invalidatedAt;
        this.deletedAt = builder.deletedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public String name() {
        return name;
    }

    public String scope() {
        return scope;
    }

    public String subscriptionId() {
        return subscriptionId;
    }

    public String location() {
        return location;
    }

    public String provisioningState() {
        return provisioningState;
    }

    public String properties() {
        return properties;
    }

    public Map<String, String> tags() {
        return tags;
    }

    public boolean managed() {
        return managed;
    }

    public Instant adoptedAt() {
        return adoptedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastRefreshed() {
        return lastRefreshed;
    }

    public Instant invalidatedAt() {
        return invalidatedAt;
    }

    public Instant deletedAt() {
        return deletedAt;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /** Fresh means refreshed within the TTL and not explicitly invalidated. */
    public boolean isFresh(Instant now, Duration ttl) {
        return deletedAt == null
                && invalidatedAt == null
                && lastRefreshed != null
                && lastRefreshed.isAfter(now.minus(ttl));
    }

    /** Last path segment of a cloud resource id. */
    public static String nameFromId(String id) {
        if (id == null) {
            return null;
        }
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }

    /** Create a builder from this resource (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .name(name)
                .scope(scope)
                .subscriptionId(subscriptionId)
                .location(location)
                .provisioningState(provisioningState)
                .properties(properties)
                .tags(tags)
                .managed(managed)
                .adoptedAt(adoptedAt)
                .createdAt(createdAt)
                .lastRefreshed(lastRefreshed)
                .invalidatedAt(invalidatedAt)
                .deletedAt(deletedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String type;
        private String name;
        private String scope;
        private String subscriptionId;
        private String location;
        private String provisioningState;
        private String properties;
        private Map<String, String> tags;
        private boolean managed;
        private Instant adoptedAt;
        private Instant createdAt;
        private Instant lastRefreshed;
        private Instant invalidatedAt;
        private Instant deletedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder subscriptionId(String subscriptionId) {
            this.subscriptionId = subscriptionId;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder provisioningState(String provisioningState) {
            this.provisioningState = provisioningState;
            return this;
        }

        public Builder properties(String properties) {
            this.properties = properties;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder managed(boolean managed) {
            this.managed = managed;
            return this;
        }

        public Builder adoptedAt(Instant adoptedAt) {
            this.adoptedAt = adoptedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastRefreshed(Instant lastRefreshed) {
            this.lastRefreshed = lastRefreshed;
            return this;
        }

        public Builder invalidatedAt(Instant invalidatedAt) {
            this.invalidatedAt = invalidatedAt;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Resource build() {
            return new Resource(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Resource resource))
            return false;
        return Objects.equals(id, resource.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Resource{name='" + name + "', type=" + type + ", managed=" + managed + "}";
    }
}
