package stratus.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.client.CloudControlPlaneClient;
import stratus.engine.error.EngineException;
import stratus.engine.graph.DependencyGraphBuilder;
import stratus.engine.graph.GraphBuildResult;
import stratus.engine.model.Resource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls resource state from the control plane into the state store.
 */
public class DiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);
    private static final int REFRESH_BATCH = 500;

    private final CloudControlPlaneClient client;
    private final ResourceStateService resources;
    private final DependencyGraphBuilder graph;

    public DiscoveryService(CloudControlPlaneClient client, ResourceStateService resources,
                            DependencyGraphBuilder graph) {
        this.client = client;
        this.resources = resources;
        this.graph = graph;
    }

    /**
     * Discover every resource in a scope, store it and rebuild the dependency graph.
     * Rows already known keep their {@code managed} flag and adoption time.
     */
    public GraphBuildResult discover(String scope) {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope is required");
        }
        String json = client.listResources(scope);
        JsonNode array = ResourceJson.tryParse(json)
                .filter(JsonNode::isArray)
                .orElseThrow(() -> new EngineException("Resource listing for " + scope + " is not a JSON array"));

        List<Resource> batch = new ArrayList<>();
        for (JsonNode node : array) {
            ResourceJson.toResource(node).ifPresentOrElse(
                    discovered -> batch.add(keepOwnership(discovered)),
                    () -> log.debug("Skipping listing entry without id/type"));
        }
        resources.storeAll(batch);
        log.info("Discovered {} resources in {}", batch.size(), scope);

        GraphBuildResult result = graph.build();
        if (result.hasCycle()) {
            log.warn("Dependency cycle among {}", result.cycleMembers());
        }
        return result;
    }

    /**
     * Re-fetch stale resources. A resource the control plane no longer knows is soft-deleted.
     *
     * @return number of resources refreshed or deleted
     */
    public int refreshStale() {
        List<Resource> stale = resources.findStale(REFRESH_BATCH);
        int handled = 0;
        for (Resource resource : stale) {
            Optional<String> current = client.showResource(resource.id());
            if (current.isEmpty()) {
                resources.markDeleted(resource.id());
                handled++;
                continue;
            }
            Optional<Resource> refreshed = ResourceJson.tryParse(current.get()).flatMap(ResourceJson::toResource);
            if (refreshed.isPresent()) {
                resources.store(keepOwnership(refreshed.get()));
                handled++;
            } else {
                log.warn("Unreadable resource document for {}", resource.id());
            }
        }
        if (!stale.isEmpty()) {
            log.info("Refreshed {}/{} stale resources", handled, stale.size());
        }
        return handled;
    }

    private Resource keepOwnership(Resource discovered) {
        return resources.findById(discovered.id())
                .map(existing -> discovered.toBuilder()
                        .managed(existing.managed())
                        .adoptedAt(existing.adoptedAt())
                        .createdAt(existing.createdAt())
                        .build())
                .orElse(discovered);
    }
}
