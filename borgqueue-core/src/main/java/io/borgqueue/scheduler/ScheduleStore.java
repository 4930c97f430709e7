package io.borgqueue.scheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Persistence of backup targets, their schedules and run bookkeeping.
 *
 * <p>Bookkeeping writes that decide whether a run happens are compare-and-set on
 * {@code nextRunAt}, so concurrent scheduler processes cannot both act on the same slot.
 */
public interface ScheduleStore {

    /**
     * Enabled targets that have a schedule.
     */
    List<ScheduledTarget> findEnabled();

    Optional<ScheduledTarget> findByScheduleId(long scheduleId);

    /**
     * Sets {@code nextRunAt} if it still equals {@code expectedNextRunAt} (null matches unset).
     *
     * @return true if this caller performed the update
     */
    boolean reschedule(long targetId, Instant expectedNextRunAt, Instant nextRunAt);

    /**
     * Takes the run slot: sets {@code lastRunAt = ranAt}, {@code nextRunAt}, {@code lastStatus = RUNNING}
     * and increments the run counter, but only if {@code nextRunAt} still equals
     * {@code expectedNextRunAt}.
     *
     * @return true if this caller owns the run and must enqueue it
     */
    boolean claimRun(long targetId, Instant expectedNextRunAt, Instant ranAt, Instant nextRunAt);

    /**
     * Records the outcome of the last run in one update: success resets the failure streak,
     * failure increments it, anything else leaves it as is.
     *
     * @return the stored failure streak after the update, empty when the target does not exist
     */
    OptionalInt recordOutcome(long targetId, RunStatus status);

    /**
     * Sets {@code nextRunAt} to {@code retryAt} if that is earlier than the stored value.
     * An unset {@code nextRunAt} stays unset.
     */
    void pullNextRunForward(long targetId, Instant retryAt);
}
