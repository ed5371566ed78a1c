package stratus.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.model.Resource;
import stratus.engine.model.ResourceFilter;
import stratus.engine.model.ResourceView;
import stratus.engine.repository.ResourceRepository;
import stratus.engine.store.StorageRetry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer over the resource state store.
 * Every call is one repository transaction, re-run on storage failure.
 */
public class ResourceStateService {

    private static final Logger log = LoggerFactory.getLogger(ResourceStateService.class);

    private final ResourceRepository resources;
    private final StorageRetry retry;

    public ResourceStateService(ResourceRepository resources, StorageRetry retry) {
        this.resources = resources;
        this.retry = retry;
    }

    public void store(Resource resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource is required");
        }
        retry.run("store resource " + resource.id(), () -> resources.store(resource));
        log.debug("Stored resource {}", resource.id());
    }

    public void storeAll(List<Resource> batch) {
        if (batch.isEmpty()) {
            return;
        }
        retry.run("store " + batch.size() + " resources", () -> resources.storeAll(batch));
        log.info("Stored {} resources", batch.size());
    }

    /**
     * Store a resource this engine created (managed) or adopted.
     */
    public Resource recordManaged(Resource resource, boolean adopted, Instant now) {
        Optional<Resource> existing = findById(resource.id());
        Resource.Builder builder = resource.toBuilder().managed(true);
        if (adopted) {
            builder.adoptedAt(existing.map(Resource::adoptedAt).filter(a -> a != null).orElse(now));
        }
        Resource toStore = builder.build();
        store(toStore);
        log.info("{} resource {} ({})", adopted ? "Adopted" : "Recorded managed", toStore.id(), toStore.type());
        return toStore;
    }

    public Optional<Resource> findById(String id) {
        return retry.call("find resource " + id, () -> resources.findById(id));
    }

    public List<ResourceView> query(ResourceFilter filter) {
        return retry.call("query resources", () -> resources.query(filter));
    }

    public int invalidate(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern is required");
        }
        int count = retry.call("invalidate " + pattern, () -> resources.invalidate(pattern));
        log.info("Invalidated {} resources matching {}", count, pattern);
        return count;
    }

    public boolean markDeleted(String id) {
        boolean deleted = retry.call("delete resource " + id, () -> resources.markDeleted(id));
        if (deleted) {
            log.info("Resource {} marked deleted", id);
        } else {
            log.debug("Resource {} not live, nothing to delete", id);
        }
        return deleted;
    }

    public List<Resource> findStale(int limit) {
        return retry.call("find stale resources", () -> resources.findStale(limit));
    }
}
