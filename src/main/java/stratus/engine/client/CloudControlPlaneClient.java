package stratus.engine.client;

import stratus.engine.operation.RenderedCommand;

import java.time.Instant;
import java.util.Optional;

/**
 * The single boundary to the cloud control plane. Implementations shell out to a CLI;
 * the engine only consumes exit codes and JSON output, never cloud-resource semantics.
 */
public interface CloudControlPlaneClient {

    /**
     * Run a short command synchronously (idempotency probes, post checks, rollback steps).
     *
     * @param command shell command line
     * @return exit code and combined output
     */
    CommandResult run(String command);

    /**
     * Fire-and-forget dispatch of long remote work.
     *
     * @param command the rendered command
     * @return handle used for polling and cancellation
     */
    RemoteHandle dispatch(RenderedCommand command);

    /**
     * Current dispatcher-reported state of the remote work.
     */
    RemoteStatus executionState(RemoteHandle handle);

    /**
     * Last-update timestamp of the heartbeat artifact the remote process refreshes.
     *
     * @return empty when no heartbeat has been written yet
     */
    Optional<Instant> readHeartbeat(RemoteHandle handle);

    /**
     * Explicitly cancel remote work.
     */
    void cancel(RemoteHandle handle);

    /**
     * Fetch one resource as JSON.
     *
     * @param resourceId the resource id
     * @return JSON text, empty if the resource no longer exists
     */
    Optional<String> showResource(String resourceId);

    /**
     * List resources in a scope as a JSON array.
     *
     * @param scope resource group
     * @return JSON array text
     */
    String listResources(String scope);
}
