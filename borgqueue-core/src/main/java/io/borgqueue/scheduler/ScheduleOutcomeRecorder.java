package io.borgqueue.scheduler;

import io.borgqueue.core.JobEvent;
import io.borgqueue.core.JobEventPublisher;
import io.borgqueue.schedule.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Writes the outcome of scheduled backup jobs back onto their target and applies the schedule's
 * retry policy.
 */
public class ScheduleOutcomeRecorder implements JobEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(ScheduleOutcomeRecorder.class);

    private final ScheduleStore scheduleStore;

    public ScheduleOutcomeRecorder(ScheduleStore scheduleStore) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
    }

    @Override
    public void publish(JobEvent event) {
        if (!event.isTerminal()) {
            return;
        }
        OptionalLong scheduleId = ScheduledTarget.scheduleIdFromKey(event.uniqueKey());
        if (scheduleId.isEmpty()) {
            return;
        }

        var found = scheduleStore.findByScheduleId(scheduleId.getAsLong());
        if (found.isEmpty()) {
            log.warn("outcome for unknown schedule id={} jobId={}", scheduleId.getAsLong(), event.jobId());
            return;
        }
        ScheduledTarget target = found.get();
        Instant at = event.at() != null ? event.at() : Instant.now();

        switch (event.status()) {
            case COMPLETED -> scheduleStore.recordOutcome(target.targetId(), RunStatus.SUCCESS);
            case CANCELLED -> scheduleStore.recordOutcome(target.targetId(), RunStatus.CANCELLED);
            case FAILED -> {
                OptionalInt failures = scheduleStore.recordOutcome(target.targetId(), RunStatus.FAILURE);
                if (failures.isEmpty()) {
                    return;
                }
                Instant retryAt = RetryPolicy.nextRetryAt(target.schedule(), failures.getAsInt(), at).orElse(null);
                if (retryAt != null) {
                    scheduleStore.pullNextRunForward(target.targetId(), retryAt);
                    log.info("Backup target id={} failed ({} in a row), retry at {}", target.targetId(), failures.getAsInt(), retryAt);
                } else {
                    log.warn("Backup target id={} failed ({} in a row), no retry left", target.targetId(), failures.getAsInt());
                }
            }
            default -> {
            }
        }
    }
}
