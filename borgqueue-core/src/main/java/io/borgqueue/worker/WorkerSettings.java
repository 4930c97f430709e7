package io.borgqueue.worker;

import io.borgqueue.core.Lanes;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings of one {@link Worker}.
 *
 * @param lane          lane the worker drains
 * @param workerId      identity written on claimed jobs
 * @param pollInterval  idle wait between empty claims
 * @param shutdownGrace how long stop() waits for the in-flight job
 */
public record WorkerSettings(
        String lane,
        String workerId,
        Duration pollInterval,
        Duration shutdownGrace
) {
    public WorkerSettings {
        Objects.requireNonNull(lane, "lane must not be null");
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace must not be null");
        if (lane.isBlank()) {
            throw new IllegalArgumentException("lane must not be blank");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be negative");
        }
        workerId = WorkerIds.resolve(workerId);
    }

    public static WorkerSettings defaults(String lane) {
        return new WorkerSettings(lane, null, Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    public static WorkerSettings defaults() {
        return defaults(Lanes.DEFAULT);
    }
}
