package io.borgqueue.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Retry policy of scheduled backups. A retry is always a new job, enqueued by the scheduler
 * once the target's next run time is reached.
 */
public final class RetryPolicy {

    private RetryPolicy() {
    }

    /**
     * @param schedule            policy owner
     * @param consecutiveFailures failures in a row including the one that just happened (1 = first)
     * @param failedAt            when the last run failed
     * @return when the retry should run, or empty if no retry is allowed
     */
    public static Optional<Instant> nextRetryAt(BackupSchedule schedule, int consecutiveFailures, Instant failedAt) {
        if (schedule == null || failedAt == null || !schedule.retryOnFailure()) {
            return Optional.empty();
        }
        if (consecutiveFailures < 1 || consecutiveFailures > schedule.maxRetries()) {
            return Optional.empty();
        }
        Duration delay = Duration.ofMinutes(Math.max(0, schedule.retryDelayMinutes()));
        return Optional.of(failedAt.plus(delay));
    }
}
