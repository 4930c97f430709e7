package io.borgqueue.schedule;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private static final Instant FAILED_AT = Instant.parse("2026-01-07T02:10:00Z");

    @Test
    void retryShouldRunAfterConfiguredDelay() {
        BackupSchedule schedule = BackupSchedule.builder(ScheduleType.DAILY)
                .time("02:00")
                .retry(true, 3, 30)
                .build();

        Optional<Instant> retryAt = RetryPolicy.nextRetryAt(schedule, 1, FAILED_AT);

        assertEquals(Optional.of(Instant.parse("2026-01-07T02:40:00Z")), retryAt);
    }

    @Test
    void retryShouldStopAfterMaxRetries() {
        BackupSchedule schedule = BackupSchedule.builder(ScheduleType.DAILY)
                .time("02:00")
                .retry(true, 2, 30)
                .build();

        assertTrue(RetryPolicy.nextRetryAt(schedule, 2, FAILED_AT).isPresent());
        assertTrue(RetryPolicy.nextRetryAt(schedule, 3, FAILED_AT).isEmpty());
    }

    @Test
    void disabledRetryShouldNeverRetry() {
        BackupSchedule schedule = BackupSchedule.builder(ScheduleType.DAILY)
                .time("02:00")
                .retry(false, 3, 30)
                .build();

        assertTrue(RetryPolicy.nextRetryAt(schedule, 1, FAILED_AT).isEmpty());
    }
}
