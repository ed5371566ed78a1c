package stratus.engine.client;

import java.time.Instant;
import java.util.Map;

/**
 * Reference to asynchronously dispatched remote work, kept by the monitor for polling
 * and cancellation.
 *
 * @param attributes client-specific addressing (target machine, scope...)
 */
public record RemoteHandle(String id, Instant dispatchedAt, Map<String, String> attributes) {

    public RemoteHandle {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
