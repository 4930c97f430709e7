package io.borgqueue.core;

/**
 * Fire-and-forget sink for {@link JobEvent}s (UI push channel, outcome recorders).
 *
 * <p>Implementations may throw; callers log and drop the failure. Delivery is best effort.
 */
@FunctionalInterface
public interface JobEventPublisher {

    void publish(JobEvent event);

    static JobEventPublisher noop() {
        return event -> {
        };
    }
}
