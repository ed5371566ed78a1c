package stratus.engine.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Parsing helpers for ARM-style resource ids
 * ({@code /subscriptions/<sub>/resourceGroups/<rg>/providers/<ns>/<type>/<name>[/<child>/<name>]}).
 */
public final class ResourceIds {

    private static final String SUBNETS_SEGMENT = "/subnets/";

    private ResourceIds() {
    }

    public static boolean looksLikeId(String value) {
        return value != null && value.regionMatches(true, 0, "/subscriptions/", 0, "/subscriptions/".length());
    }

    public static String name(String id) {
        String trimmed = stripTrailingSlash(id);
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    /**
     * Provider type of the id, e.g. {@code Microsoft.Network/virtualNetworks/subnets}.
     */
    public static String type(String id) {
        String[] parts = stripTrailingSlash(id).split("/");
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].equalsIgnoreCase("providers") && i + 2 < parts.length) {
                StringBuilder type = new StringBuilder(parts[i + 1]).append('/').append(parts[i + 2]);
                // child types alternate type/name after the first name
                for (int j = i + 4; j < parts.length; j += 2) {
                    type.append('/').append(parts[j]);
                }
                return type.toString();
            }
        }
        return "unknown";
    }

    public static Optional<String> resourceGroup(String id) {
        String[] parts = stripTrailingSlash(id).split("/");
        for (int i = 0; i + 1 < parts.length; i++) {
            if (parts[i].equalsIgnoreCase("resourceGroups")) {
                return Optional.of(parts[i + 1]);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> subscription(String id) {
        String[] parts = stripTrailingSlash(id).split("/");
        for (int i = 0; i + 1 < parts.length; i++) {
            if (parts[i].equalsIgnoreCase("subscriptions")) {
                return Optional.of(parts[i + 1]);
            }
        }
        return Optional.empty();
    }

    /**
     * Parent network id of a subnet id, or empty if the id is not a subnet.
     */
    public static Optional<String> parentNetworkOfSubnet(String subnetId) {
        if (subnetId == null) {
            return Optional.empty();
        }
        int idx = subnetId.toLowerCase(Locale.ROOT).indexOf(SUBNETS_SEGMENT);
        return idx > 0 ? Optional.of(subnetId.substring(0, idx)) : Optional.empty();
    }

    /**
     * Case-insensitive suffix match on the resource type, so {@code virtualMachines}
     * matches {@code Microsoft.Compute/virtualMachines}.
     */
    public static boolean isType(String type, String suffix) {
        if (type == null) {
            return false;
        }
        String t = type.toLowerCase(Locale.ROOT);
        String s = suffix.toLowerCase(Locale.ROOT);
        return t.equals(s) || t.endsWith("/" + s);
    }

    private static String stripTrailingSlash(String id) {
        return id.endsWith("/") ? id.substring(0, id.length() - 1) : id;
    }
}
