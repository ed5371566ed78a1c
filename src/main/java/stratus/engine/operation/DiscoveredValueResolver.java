package stratus.engine.operation;

import stratus.engine.config.ConfigProvider;
import stratus.engine.model.Resource;
import stratus.engine.model.ResourceFilter;
import stratus.engine.model.ResourceView;
import stratus.engine.repository.ResourceRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fills template tokens from resources already recorded in the state store.
 * A token is mapped to a resource type by name ({@code *VNET*_NAME} to virtual networks, and so
 * on); a value is produced only when exactly one fresh resource of that type exists in the
 * configured resource group, so an ambiguous environment never silently picks one.
 */
public class DiscoveredValueResolver {

    private static final Map<String, String> TYPE_BY_KEYWORD = new LinkedHashMap<>();

    static {
        TYPE_BY_KEYWORD.put("SUBNET", "Microsoft.Network/virtualNetworks/subnets");
        TYPE_BY_KEYWORD.put("VNET", "Microsoft.Network/virtualNetworks");
        TYPE_BY_KEYWORD.put("VIRTUAL_NETWORK", "Microsoft.Network/virtualNetworks");
        TYPE_BY_KEYWORD.put("NSG", "Microsoft.Network/networkSecurityGroups");
        TYPE_BY_KEYWORD.put("NETWORK_SECURITY", "Microsoft.Network/networkSecurityGroups");
        TYPE_BY_KEYWORD.put("STORAGE_ACCOUNT", "Microsoft.Storage/storageAccounts");
        TYPE_BY_KEYWORD.put("HOST_POOL", "Microsoft.DesktopVirtualization/hostPools");
        TYPE_BY_KEYWORD.put("APP_GROUP", "Microsoft.DesktopVirtualization/applicationGroups");
        TYPE_BY_KEYWORD.put("APPLICATION_GROUP", "Microsoft.DesktopVirtualization/applicationGroups");
        TYPE_BY_KEYWORD.put("WORKSPACE", "Microsoft.DesktopVirtualization/workspaces");
    }

    static final String RESOURCE_GROUP_KEY = "AZURE_RESOURCE_GROUP";

    private final ResourceRepository resources;
    private final ConfigProvider config;

    public DiscoveredValueResolver(ResourceRepository resources, ConfigProvider config) {
        this.resources = resources;
        this.config = config;
    }

    public Optional<String> resolve(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        boolean wantsId = upper.endsWith("_ID");
        if (!wantsId && !upper.endsWith("_NAME")) {
            return Optional.empty();
        }
        Optional<String> type = typeFor(upper);
        if (type.isEmpty()) {
            return Optional.empty();
        }

        ResourceFilter filter = ResourceFilter.byType(type.get());
        Optional<String> group = config.get(RESOURCE_GROUP_KEY);
        if (group.isPresent()) {
            filter = filter.inScope(group.get());
        }
        List<Resource> fresh = resources.query(filter).stream()
                .filter(ResourceView::fresh)
                .map(ResourceView::resource)
                .toList();
        if (fresh.size() != 1) {
            return Optional.empty();
        }
        Resource only = fresh.get(0);
        return Optional.of(wantsId ? only.id() : only.name());
    }

    static Optional<String> typeFor(String token) {
        for (Map.Entry<String, String> entry : TYPE_BY_KEYWORD.entrySet()) {
            if (token.contains(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
