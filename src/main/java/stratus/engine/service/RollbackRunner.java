package stratus.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.client.CloudControlPlaneClient;
import stratus.engine.client.CommandResult;
import stratus.engine.error.EngineException;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.operation.ResolvedParameters;
import stratus.engine.operation.RollbackSpec;
import stratus.engine.operation.TemplateRenderer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs declared rollback steps in reverse order after a failed execution.
 * Never throws: a failing step is logged and the remaining steps still run.
 */
public class RollbackRunner {

    private static final Logger log = LoggerFactory.getLogger(RollbackRunner.class);

    private final CloudControlPlaneClient client;
    private final TemplateRenderer renderer;

    public RollbackRunner(CloudControlPlaneClient client, TemplateRenderer renderer) {
        this.client = client;
        this.renderer = renderer;
    }

    /**
     * @return number of steps that completed successfully
     */
    public int rollback(OperationDefinition definition, ResolvedParameters params) {
        RollbackSpec spec = definition.rollback();
        if (!spec.enabled() || spec.steps().isEmpty()) {
            return 0;
        }
        List<String> steps = new ArrayList<>(spec.steps());
        Collections.reverse(steps);
        log.warn("Rolling back {} ({} steps)", definition.id(), steps.size());

        int succeeded = 0;
        for (String step : steps) {
            try {
                CommandResult result = client.run(renderer.substitute(step, params, definition.id() + " rollback"));
                if (result.succeeded()) {
                    succeeded++;
                } else {
                    log.error("Rollback step of {} exited with {}", definition.id(), result.exitCode());
                }
            } catch (EngineException e) {
                log.error("Rollback step of {} failed: {}", definition.id(), e.getMessage());
            }
        }
        log.warn("Rollback of {} finished: {}/{} steps succeeded", definition.id(), succeeded, steps.size());
        return succeeded;
    }
}
