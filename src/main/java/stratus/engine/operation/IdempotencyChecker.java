package stratus.engine.operation;

import stratus.engine.client.CloudControlPlaneClient;
import stratus.engine.client.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation's idempotency probe through the control-plane client.
 * The probe counts as satisfied when it exits 0 and prints a non-empty JSON value.
 */
public class IdempotencyChecker {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyChecker.class);

    private final CloudControlPlaneClient client;
    private final TemplateRenderer renderer;

    public IdempotencyChecker(CloudControlPlaneClient client, TemplateRenderer renderer) {
        this.client = client;
        this.renderer = renderer;
    }

    public IdempotencyResult check(OperationDefinition definition, ResolvedParameters params) {
        IdempotencySpec spec = definition.idempotency();
        if (!spec.declared()) {
            return IdempotencyResult.NOT_CHECKED;
        }

        String probe = renderer.substitute(spec.checkCommand(), params, definition.id() + " idempotency probe");
        log.debug("Running idempotency probe for {}", definition.id());
        CommandResult result = client.run(probe);

        if (!result.hasContent()) {
            log.info("Idempotency probe for {}: target not present", definition.id());
            return IdempotencyResult.NOT_SATISFIED;
        }
        if (spec.skipIfExists()) {
            log.info("Idempotency probe for {}: already satisfied, skipping", definition.id());
            return IdempotencyResult.ALREADY_SATISFIED;
        }
        log.info("Idempotency probe for {}: target exists, running anyway (skip_if_exists=false)",
                definition.id());
        return IdempotencyResult.SATISFIED_NO_SKIP;
    }
}
