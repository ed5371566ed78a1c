package stratus.engine.repository;

import stratus.engine.model.Resource;
import stratus.engine.model.ResourceFilter;
import stratus.engine.model.ResourceView;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for tracked cloud resources.
 * Every mutating method is one atomic transaction.
 */
public interface ResourceRepository {

    /**
     * Upsert a resource by id. Refreshes {@code last_refreshed} and clears
     * any previous invalidation or soft delete.
     *
     * @param resource the resource to store
     */
    void store(Resource resource);

    /**
     * Upsert several resources in a single transaction.
     *
     * @param resources the resources to store
     */
    void storeAll(List<Resource> resources);

    /**
     * Find a resource by id, including soft-deleted rows.
     *
     * @param id the external resource id
     * @return the resource if known
     */
    Optional<Resource> findById(String id);

    /**
     * Query resources. Stale rows are returned with {@code fresh=false}, never hidden.
     *
     * @param filter the filter
     * @return matching rows ordered by type then name
     */
    List<ResourceView> query(ResourceFilter filter);

    /**
     * Mark resources stale without deleting them.
     *
     * @param pattern glob ({@code *} wildcard) matched against id or type
     * @return number of rows invalidated
     */
    int invalidate(String pattern);

    /**
     * Soft delete a resource.
     *
     * @param id the resource id
     * @return true if a live row was marked deleted
     */
    boolean markDeleted(String id);

    /**
     * Non-deleted resources that are no longer fresh.
     *
     * @param limit maximum results
     * @return stale resources, oldest refresh first
     */
    List<Resource> findStale(int limit);
}
