package stratus.engine.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.operation.OperationCatalog;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.operation.OperationDefinitionParser;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a step's operation reference: literal path, project root, workflows root,
 * then catalog id.
 */
public class OperationLocator {

    private static final Logger log = LoggerFactory.getLogger(OperationLocator.class);

    private final Path projectRoot;
    private final Path workflowsRoot;
    private final OperationCatalog catalog;
    private final OperationDefinitionParser parser;

    public OperationLocator(Path projectRoot, Path workflowsRoot, OperationCatalog catalog,
                            OperationDefinitionParser parser) {
        this.projectRoot = projectRoot;
        this.workflowsRoot = workflowsRoot;
        this.catalog = catalog;
        this.parser = parser;
    }

    public Optional<OperationDefinition> locate(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        for (Path candidate : candidates(reference)) {
            if (Files.isRegularFile(candidate)) {
                log.debug("Operation {} resolved to {}", reference, candidate);
                return Optional.of(parser.parse(candidate));
            }
        }
        return catalog.findById(reference);
    }

    private List<Path> candidates(String reference) {
        List<Path> paths = new ArrayList<>();
        Path literal;
        try {
            literal = Path.of(reference);
        } catch (InvalidPathException e) {
            return paths;
        }
        paths.add(literal);
        if (!literal.isAbsolute()) {
            paths.add(projectRoot.resolve(literal));
            paths.add(workflowsRoot.resolve(literal));
        }
        return paths;
    }
}
