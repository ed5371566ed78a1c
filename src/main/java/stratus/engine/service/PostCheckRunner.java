package stratus.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.client.CloudControlPlaneClient;
import stratus.engine.client.CommandResult;
import stratus.engine.error.OperationExecutionException;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.operation.PostCheck;
import stratus.engine.operation.ResolvedParameters;
import stratus.engine.operation.TemplateRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the post-execution checks declared under {@code validation.checks}.
 */
public class PostCheckRunner {

    private static final Logger log = LoggerFactory.getLogger(PostCheckRunner.class);

    private final CloudControlPlaneClient client;
    private final TemplateRenderer renderer;

    public PostCheckRunner(CloudControlPlaneClient client, TemplateRenderer renderer) {
        this.client = client;
        this.renderer = renderer;
    }

    /**
     * @return descriptions of checks that could not be run locally
     * @throws OperationExecutionException when an executable check fails
     */
    public List<String> run(OperationDefinition definition, ResolvedParameters params) {
        if (!definition.validationEnabled()) {
            return List.of();
        }
        List<String> deferred = new ArrayList<>();
        for (PostCheck check : definition.checks()) {
            String label = check.description() != null ? check.description() : check.type();
            if (!check.executable()) {
                log.info("{}: check '{}' requires remote validation", definition.id(), label);
                deferred.add(label);
                continue;
            }
            String command = renderer.substitute(check.command(), params, definition.id() + " check " + label);
            CommandResult result = client.run(command);
            if (!result.succeeded()) {
                throw new OperationExecutionException(definition.id() + ": check '" + label + "' exited with "
                        + result.exitCode(), result.exitCode(), result.lines());
            }
            if (check.expect() != null && (result.output() == null || !result.output().contains(check.expect()))) {
                throw new OperationExecutionException(definition.id() + ": check '" + label
                        + "' output does not contain '" + check.expect() + "'", result.exitCode(), result.lines());
            }
            log.info("{}: check '{}' passed", definition.id(), label);
        }
        return deferred;
    }
}
