package io.borgqueue.core;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a persisted job record.
 */
public record Job(
        long id,
        String queue,
        String type,
        Map<String, Object> payload,
        JobStatus status,

        // progress is advisory
        int progress,
        String progressMessage,

        int attempts,
        int maxAttempts,

        String output,
        String error,

        Instant startedAt,
        Instant completedAt,
        Instant createdAt,
        Long createdBy,

        // idempotency key for producers that must not double-enqueue
        String uniqueKey,
        String workerId
) {
    public Job {
        payload = payload == null ? Map.of() : payload;
    }

    public boolean isFinished() {
        return status != null && status.isTerminal();
    }

    /**
     * A failed job may be resubmitted as a new record while attempts remain.
     */
    public boolean canRetry() {
        return status == JobStatus.FAILED && attempts < maxAttempts;
    }
}
