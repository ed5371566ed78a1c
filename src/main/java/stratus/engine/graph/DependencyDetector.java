package stratus.engine.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import stratus.engine.model.DependencyEdge;
import stratus.engine.model.DependencyKind;
import stratus.engine.model.Relationship;
import stratus.engine.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts dependency edges from a resource's property bag.
 * Known resource types have dedicated extractors; any other type falls back to
 * collecting every embedded resource id as a plain reference.
 */
public class DependencyDetector {

    private static final Logger log = LoggerFactory.getLogger(DependencyDetector.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @FunctionalInterface
    interface Extractor {
        void extract(JsonNode props, EdgeCollector edges);
    }

    private final Map<String, Extractor> extractors = new LinkedHashMap<>();

    public DependencyDetector() {
        extractors.put("virtualmachines", DependencyDetector::virtualMachine);
        extractors.put("networkinterfaces", DependencyDetector::networkInterface);
        extractors.put("virtualnetworks", DependencyDetector::virtualNetwork);
        extractors.put("storageaccounts", DependencyDetector::storageAccount);
        extractors.put("applicationgroups", DependencyDetector::applicationGroup);
        extractors.put("workspaces", DependencyDetector::workspace);
        extractors.put("hostpools", (props, edges) -> {
            // host pools are roots of the desktop hierarchy
        });
    }

    /**
     * Detect the edges leaving a resource. Self-references and duplicates are dropped.
     *
     * @param resource the resource
     * @return edges where the resource is the source
     */
    public List<DependencyEdge> detect(Resource resource) {
        JsonNode props = parse(resource);
        EdgeCollector edges = new EdgeCollector(resource.id());

        Extractor extractor = extractors.get(typeKey(resource.type()));
        if (extractor != null) {
            extractor.extract(props, edges);
        } else {
            generic(props, edges);
        }

        List<DependencyEdge> detected = edges.edges();
        log.debug("Detected {} dependencies for {}", detected.size(), resource.id());
        return detected;
    }

    // ==================== Per-type extractors ====================

    private static void virtualMachine(JsonNode props, EdgeCollector edges) {
        for (JsonNode nic : props.path("networkProfile").path("networkInterfaces")) {
            edges.add(nic.path("id"), DependencyKind.REQUIRED, Relationship.USES);
        }
        JsonNode storage = props.path("storageProfile");
        edges.add(storage.path("osDisk").path("managedDisk").path("id"), DependencyKind.REQUIRED, Relationship.USES);
        for (JsonNode disk : storage.path("dataDisks")) {
            edges.add(disk.path("managedDisk").path("id"), DependencyKind.REQUIRED, Relationship.USES);
        }
        edges.add(storage.path("imageReference").path("id"), DependencyKind.REFERENCE, Relationship.USES);
        edges.add(props.path("availabilitySet").path("id"), DependencyKind.OPTIONAL, Relationship.REFERENCES);
    }

    private static void networkInterface(JsonNode props, EdgeCollector edges) {
        for (JsonNode ipConfig : props.path("ipConfigurations")) {
            JsonNode cfg = unwrap(ipConfig);
            String subnetId = cfg.path("subnet").path("id").asText(null);
            edges.add(subnetId, DependencyKind.REQUIRED, Relationship.USES);
            ResourceIds.parentNetworkOfSubnet(subnetId)
                    .ifPresent(vnet -> edges.add(vnet, DependencyKind.REQUIRED, Relationship.USES));
            edges.add(cfg.path("publicIPAddress").path("id"), DependencyKind.OPTIONAL, Relationship.USES);
            for (JsonNode pool : cfg.path("loadBalancerBackendAddressPools")) {
                String poolId = pool.path("id").asText(null);
                if (poolId != null) {
                    int idx = poolId.toLowerCase(Locale.ROOT).indexOf("/backendaddresspools/");
                    edges.add(idx > 0 ? poolId.substring(0, idx) : poolId, DependencyKind.OPTIONAL,
                            Relationship.REFERENCES);
                }
            }
            for (JsonNode asg : cfg.path("applicationSecurityGroups")) {
                edges.add(asg.path("id"), DependencyKind.OPTIONAL, Relationship.REFERENCES);
            }
        }
        edges.add(props.path("networkSecurityGroup").path("id"), DependencyKind.OPTIONAL, Relationship.REFERENCES);
    }

    private static void virtualNetwork(JsonNode props, EdgeCollector edges) {
        for (JsonNode subnet : props.path("subnets")) {
            edges.add(subnet.path("id"), DependencyKind.REQUIRED, Relationship.CONTAINS);
        }
        for (JsonNode peering : props.path("virtualNetworkPeerings")) {
            JsonNode remote = unwrap(peering).path("remoteVirtualNetwork").path("id");
            edges.add(remote, DependencyKind.REFERENCE, Relationship.PEERS_WITH);
        }
        edges.add(props.path("ddosProtectionPlan").path("id"), DependencyKind.OPTIONAL, Relationship.REFERENCES);
    }

    private static void storageAccount(JsonNode props, EdgeCollector edges) {
        for (JsonNode rule : props.path("networkAcls").path("virtualNetworkRules")) {
            String subnetId = rule.has("id") ? rule.path("id").asText(null)
                    : rule.path("virtualNetworkResourceId").asText(null);
            edges.add(subnetId, DependencyKind.OPTIONAL, Relationship.REFERENCES);
            ResourceIds.parentNetworkOfSubnet(subnetId)
                    .ifPresent(vnet -> edges.add(vnet, DependencyKind.OPTIONAL, Relationship.REFERENCES));
        }
        for (JsonNode endpoint : props.path("privateEndpointConnections")) {
            edges.add(unwrap(endpoint).path("privateEndpoint").path("id"), DependencyKind.OPTIONAL,
                    Relationship.REFERENCES);
        }
    }

    private static void applicationGroup(JsonNode props, EdgeCollector edges) {
        edges.add(props.path("hostPoolArmPath"), DependencyKind.REQUIRED, Relationship.REFERENCES);
    }

    private static void workspace(JsonNode props, EdgeCollector edges) {
        if (!props.has("applicationGroupReferences")) {
            // not a desktop workspace (e.g. a log analytics workspace)
            generic(props, edges);
            return;
        }
        for (JsonNode ref : props.path("applicationGroupReferences")) {
            edges.add(ref, DependencyKind.OPTIONAL, Relationship.REFERENCES);
        }
    }

    private static void generic(JsonNode node, EdgeCollector edges) {
        if (node.isTextual()) {
            if (ResourceIds.looksLikeId(node.asText())) {
                edges.add(node.asText(), DependencyKind.REFERENCE, Relationship.REFERENCES);
            }
        } else if (node.isContainerNode()) {
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                generic(children.next(), edges);
            }
        }
    }

    // ==================== Helpers ====================

    /** Sub-resources may carry their fields under a nested {@code properties} object. */
    private static JsonNode unwrap(JsonNode node) {
        JsonNode nested = node.path("properties");
        return nested.isObject() ? nested : node;
    }

    private static JsonNode parse(Resource resource) {
        try {
            JsonNode root = MAPPER.readTree(resource.properties());
            if (root == null || root.isMissingNode()) {
                return MAPPER.createObjectNode();
            }
            return unwrap(root);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable property bag on {}: {}", resource.id(), e.getOriginalMessage());
            return MAPPER.createObjectNode();
        }
    }

    private static String typeKey(String type) {
        String t = type.toLowerCase(Locale.ROOT);
        int slash = t.lastIndexOf('/');
        return slash >= 0 ? t.substring(slash + 1) : t;
    }

    /**
     * Collects edges for one source, skipping blanks, self-references and repeats.
     */
    static final class EdgeCollector {
        private final String sourceId;
        private final Map<String, DependencyEdge> edges = new LinkedHashMap<>();

        EdgeCollector(String sourceId) {
            this.sourceId = sourceId;
        }

        void add(JsonNode idNode, DependencyKind kind, Relationship relationship) {
            add(idNode.isTextual() ? idNode.asText() : null, kind, relationship);
        }

        void add(String targetId, DependencyKind kind, Relationship relationship) {
            if (targetId == null || targetId.isBlank() || targetId.equalsIgnoreCase(sourceId)) {
                return;
            }
            String key = targetId.toLowerCase(Locale.ROOT) + "|" + relationship;
            edges.putIfAbsent(key, new DependencyEdge(sourceId, targetId, kind, relationship));
        }

        List<DependencyEdge> edges() {
            return new ArrayList<>(edges.values());
        }
    }
}
