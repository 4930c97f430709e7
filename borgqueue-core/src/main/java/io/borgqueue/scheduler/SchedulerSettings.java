package io.borgqueue.scheduler;

import io.borgqueue.core.Lanes;

import java.time.Duration;
import java.util.Objects;

/**
 * Cadences and enqueue defaults of {@link BackupScheduler}.
 */
public record SchedulerSettings(
        Duration tickInterval,
        Duration maintenanceInterval,
        String backupLane,
        int backupMaxAttempts,
        int maintenanceMaxAttempts,
        Duration jobRetention
) {
    public SchedulerSettings {
        Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        Objects.requireNonNull(maintenanceInterval, "maintenanceInterval must not be null");
        Objects.requireNonNull(backupLane, "backupLane must not be null");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be a positive duration");
        }
        if (maintenanceInterval.isZero() || maintenanceInterval.isNegative()) {
            throw new IllegalArgumentException("maintenanceInterval must be a positive duration");
        }
        if (backupMaxAttempts < 1 || maintenanceMaxAttempts < 1) {
            throw new IllegalArgumentException("max attempts must be at least 1");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
                Duration.ofSeconds(60),
                Duration.ofMinutes(15),
                Lanes.DEFAULT,
                3,
                2,
                Duration.ofDays(30)
        );
    }
}
