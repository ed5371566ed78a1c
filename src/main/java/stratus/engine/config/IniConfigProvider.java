package stratus.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads deployment settings from an INI file, falling back to environment variables.
 * Plain keys are searched across all sections, case-insensitively; {@code SECTION.key}
 * addresses one section. The section-prefixed form {@code SECTION_KEY} also matches,
 * so {@code AZURE_LOCATION} finds {@code location} under {@code [AZURE]}.
 */
public final class IniConfigProvider implements ConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(IniConfigProvider.class);

    private final Ini ini;
    private final Function<String, String> environment;

    IniConfigProvider(Ini ini, Function<String, String> environment) {
        this.ini = ini;
        this.environment = environment;
    }

    /**
     * Load the file if it exists; a missing file yields an environment-only provider.
     */
    public static IniConfigProvider load(Path file) {
        return load(file, System::getenv);
    }

    public static IniConfigProvider load(Path file, Function<String, String> environment) {
        Ini ini = new Ini();
        if (file != null && Files.isRegularFile(file)) {
            try {
                ini.load(file.toFile());
                log.info("Loaded deployment config from {} ({} sections)", file, ini.size());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read deployment config: " + file, e);
            }
        } else {
            log.debug("No deployment config at {}, using environment only", file);
        }
        return new IniConfigProvider(ini, environment);
    }

    @Override
    public Optional<String> get(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String fromFile = fromIni(key.trim());
        if (fromFile != null && !fromFile.isBlank()) {
            return Optional.of(fromFile.trim());
        }
        String fromEnv = environment.apply(key.trim());
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(fromEnv);
        }
        return Optional.empty();
    }

    private String fromIni(String key) {
        int dot = key.indexOf('.');
        if (dot > 0) {
            return opt(section(key.substring(0, dot)), key.substring(dot + 1));
        }
        for (Profile.Section section : ini.values()) {
            String value = opt(section, key);
            if (value != null) {
                return value;
            }
            String prefix = section.getName() + "_";
            if (key.regionMatches(true, 0, prefix, 0, prefix.length())) {
                value = opt(section, key.substring(prefix.length()));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private Profile.Section section(String name) {
        for (Profile.Section section : ini.values()) {
            if (section.getName().equalsIgnoreCase(name)) {
                return section;
            }
        }
        return null;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : s.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
