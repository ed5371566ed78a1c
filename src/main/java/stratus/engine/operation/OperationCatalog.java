package stratus.engine.operation;

import stratus.engine.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Index of operation definitions laid out as
 * {@code <capabilities>/<capability>/operations/<operation>.yaml}.
 * The directory is scanned lazily and rescanned on {@link #refresh()}.
 */
public class OperationCatalog {

    private static final Logger log = LoggerFactory.getLogger(OperationCatalog.class);

    private final Path capabilitiesDir;
    private final OperationDefinitionParser parser;

    private Map<String, OperationDefinition> byId;

    public OperationCatalog(Path capabilitiesDir, OperationDefinitionParser parser) {
        this.capabilitiesDir = capabilitiesDir;
        this.parser = parser;
    }

    public synchronized void refresh() {
        byId = null;
    }

    public Optional<OperationDefinition> findById(String operationId) {
        return Optional.ofNullable(index().get(operationId));
    }

    public boolean exists(String operationId) {
        return index().containsKey(operationId);
    }

    public List<OperationDefinition> all() {
        return new ArrayList<>(index().values());
    }

    /**
     * Capability names that contain at least one operation, sorted.
     */
    public List<String> capabilities() {
        return index().values().stream()
                .map(OperationDefinition::capability)
                .filter(c -> c != null)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Operations of a capability in file-name order, which is the intended execution order.
     */
    public List<OperationDefinition> operationsOf(String capability) {
        return index().values().stream()
                .filter(d -> capability.equals(d.capability()))
                .sorted((a, b) -> a.source().getFileName().toString()
                        .compareTo(b.source().getFileName().toString()))
                .toList();
    }

    private synchronized Map<String, OperationDefinition> index() {
        if (byId == null) {
            byId = scan();
        }
        return byId;
    }

    private Map<String, OperationDefinition> scan() {
        Map<String, OperationDefinition> found = new LinkedHashMap<>();
        if (!Files.isDirectory(capabilitiesDir)) {
            log.debug("Capabilities directory {} does not exist", capabilitiesDir);
            return found;
        }
        try (Stream<Path> files = Files.walk(capabilitiesDir)) {
            List<Path> documents = files
                    .filter(Files::isRegularFile)
                    .filter(OperationCatalog::isDefinitionFile)
                    .sorted()
                    .toList();
            for (Path file : documents) {
                try {
                    OperationDefinition definition = parser.parse(file);
                    OperationDefinition previous = found.putIfAbsent(definition.id(), definition);
                    if (previous != null) {
                        log.warn("Duplicate operation id {} in {} (already defined in {})",
                                definition.id(), file, previous.source());
                    }
                } catch (ValidationException e) {
                    log.warn("Skipping unreadable operation definition {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + capabilitiesDir, e);
        }
        log.debug("Indexed {} operation definitions under {}", found.size(), capabilitiesDir);
        return found;
    }

    private static boolean isDefinitionFile(Path file) {
        Path parent = file.getParent();
        if (parent == null || parent.getFileName() == null
                || !parent.getFileName().toString().equals("operations")) {
            return false;
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }
}
