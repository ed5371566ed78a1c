package stratus.engine.config;

import java.util.Optional;

/**
 * Source of deployment configuration values (resource group, location, naming prefixes...).
 * Consulted for {@code from_config} parameter mappings and template tokens.
 */
public interface ConfigProvider {

    /**
     * Look up a configuration value.
     *
     * @param key the key, either plain ({@code AZURE_LOCATION}) or section-qualified
     *            ({@code AZURE.location})
     * @return the value if present and not blank
     */
    Optional<String> get(String key);

    /**
     * A provider that never has a value.
     */
    static ConfigProvider empty() {
        return key -> Optional.empty();
    }
}
