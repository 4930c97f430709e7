package io.borgqueue.scheduler;

import io.borgqueue.schedule.BackupSchedule;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * A backup target together with its schedule and run bookkeeping.
 *
 * <p>The scheduler never changes the schedule policy; it only moves
 * {@code lastRunAt / nextRunAt / lastStatus / consecutiveFailures}.
 */
public record ScheduledTarget(
        long targetId,
        String name,
        long repositoryId,
        long serverId,
        String serverName,
        boolean enabled,
        BackupSchedule schedule,

        // bookkeeping
        Instant lastRunAt,
        Instant nextRunAt,
        RunStatus lastStatus,
        int consecutiveFailures
) {
    public static final String SCHEDULE_KEY_PREFIX = "backup-schedule:";

    /**
     * Idempotency key of jobs enqueued for this target's schedule.
     */
    public String uniqueKey() {
        return scheduleKey(schedule.id());
    }

    public boolean isDue(Instant now) {
        return nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public static String scheduleKey(long scheduleId) {
        return SCHEDULE_KEY_PREFIX + scheduleId;
    }

    /**
     * Reverse of {@link #scheduleKey(long)}.
     */
    public static OptionalLong scheduleIdFromKey(String uniqueKey) {
        if (uniqueKey == null || !uniqueKey.startsWith(SCHEDULE_KEY_PREFIX)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(uniqueKey.substring(SCHEDULE_KEY_PREFIX.length())));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
