package stratus.engine.repository;

import stratus.engine.model.DependencyEdge;

import java.util.List;

/**
 * Repository interface for dependency edges between resources.
 * Inserting a duplicate edge is a no-op; self-loops are never stored.
 */
public interface DependencyRepository {

    /**
     * Insert an edge if not already present.
     *
     * @param edge the edge
     * @return true if a new row was inserted
     */
    boolean add(DependencyEdge edge);

    /**
     * Insert edges in one transaction, skipping duplicates and self-loops.
     *
     * @param edges the edges
     * @return number of new rows inserted
     */
    int addAll(List<DependencyEdge> edges);

    /**
     * All edges.
     */
    List<DependencyEdge> findAll();

    /**
     * Edges leaving the resource (what it depends on).
     *
     * @param resourceId the source resource
     * @return outgoing edges
     */
    List<DependencyEdge> findDependencies(String resourceId);

    /**
     * Edges entering the resource (what depends on it).
     *
     * @param resourceId the target resource
     * @return incoming edges
     */
    List<DependencyEdge> findDependents(String resourceId);
}
