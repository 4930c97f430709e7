package io.borgqueue.scheduler;

import java.util.Map;
import java.util.Objects;

/**
 * Fixed-cadence job the scheduler enqueues unless an equivalent one is still active.
 */
public record MaintenanceTask(
        String type,
        String uniqueKey,
        Map<String, Object> payload
) {
    public MaintenanceTask {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(uniqueKey, "uniqueKey must not be null");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
