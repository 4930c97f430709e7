package io.borgqueue.core;

import java.time.Instant;

/**
 * Push-channel message emitted on every progress update and terminal transition.
 */
public record JobEvent(
        long jobId,
        String queue,
        String type,
        JobStatus status,
        int progress,
        String message,
        String uniqueKey,
        Instant at
) {

    public static JobEvent of(Job job, String message, Instant at) {
        return new JobEvent(
                job.id(),
                job.queue(),
                job.type(),
                job.status(),
                job.progress(),
                message,
                job.uniqueKey(),
                at
        );
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
