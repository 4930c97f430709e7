package io.borgqueue.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.borgqueue.InMemoryJobQueue;
import io.borgqueue.JobContext;
import io.borgqueue.JobHandler;
import io.borgqueue.core.JobEvent;
import io.borgqueue.core.JobHandlerRegistry;
import io.borgqueue.core.JobStatus;
import io.borgqueue.core.Lanes;
import io.borgqueue.schedule.BackupSchedule;
import io.borgqueue.schedule.ScheduleType;
import io.borgqueue.worker.Worker;
import io.borgqueue.worker.WorkerSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleOutcomeRecorderTest {

    private static final Instant FAILED_AT = Instant.parse("2026-01-06T02:20:00Z");
    private static final Instant NEXT_RUN = Instant.parse("2026-01-07T02:00:00Z");

    private final InMemoryScheduleStore store = new InMemoryScheduleStore();
    private final ScheduleOutcomeRecorder recorder = new ScheduleOutcomeRecorder(store);

    @BeforeEach
    void setUp() {
        store.save(target(0));
    }

    @Test
    void completedRunShouldResetFailures() {
        store.save(target(2));

        recorder.publish(event(JobStatus.COMPLETED, "backup-schedule:7"));

        ScheduledTarget updated = store.get(1L);
        assertEquals(RunStatus.SUCCESS, updated.lastStatus());
        assertEquals(0, updated.consecutiveFailures());
        assertEquals(NEXT_RUN, updated.nextRunAt());
    }

    @Test
    void failedRunShouldPullRetryForward() {
        recorder.publish(event(JobStatus.FAILED, "backup-schedule:7"));

        ScheduledTarget updated = store.get(1L);
        assertEquals(RunStatus.FAILURE, updated.lastStatus());
        assertEquals(1, updated.consecutiveFailures());
        assertEquals(Instant.parse("2026-01-06T02:50:00Z"), updated.nextRunAt());
    }

    @Test
    void exhaustedRetriesShouldKeepRegularNextRun() {
        store.save(target(3));

        recorder.publish(event(JobStatus.FAILED, "backup-schedule:7"));

        ScheduledTarget updated = store.get(1L);
        assertEquals(4, updated.consecutiveFailures());
        assertEquals(NEXT_RUN, updated.nextRunAt());
    }

    @Test
    void repeatedFailuresShouldCountInStore() {
        recorder.publish(event(JobStatus.FAILED, "backup-schedule:7"));
        recorder.publish(event(JobStatus.FAILED, "backup-schedule:7"));

        ScheduledTarget updated = store.get(1L);
        assertEquals(2, updated.consecutiveFailures());
        assertEquals(Instant.parse("2026-01-06T02:50:00Z"), updated.nextRunAt());
    }

    @Test
    void retryShouldNotScheduleTargetWithoutNextRun() {
        ScheduledTarget t = target(0);
        store.save(new ScheduledTarget(t.targetId(), t.name(), t.repositoryId(), t.serverId(), t.serverName(),
                t.enabled(), t.schedule(), t.lastRunAt(), null, null, 0));

        recorder.publish(event(JobStatus.FAILED, "backup-schedule:7"));

        assertEquals(1, store.get(1L).consecutiveFailures());
        assertNull(store.get(1L).nextRunAt());
    }

    @Test
    void cancelledRunShouldKeepFailureCount() {
        store.save(target(2));

        recorder.publish(event(JobStatus.CANCELLED, "backup-schedule:7"));

        assertEquals(RunStatus.CANCELLED, store.get(1L).lastStatus());
        assertEquals(2, store.get(1L).consecutiveFailures());
    }

    @Test
    void unrelatedEventsShouldBeIgnored() {
        recorder.publish(event(JobStatus.FAILED, "server-stats:3"));
        recorder.publish(event(JobStatus.FAILED, null));
        recorder.publish(event(JobStatus.RUNNING, "backup-schedule:7"));
        recorder.publish(event(JobStatus.FAILED, "backup-schedule:99"));

        assertNull(store.get(1L).lastStatus());
        assertEquals(0, store.get(1L).consecutiveFailures());
    }

    @Test
    void scheduleKeyShouldRoundTrip() {
        assertEquals("backup-schedule:7", ScheduledTarget.scheduleKey(7));
        assertEquals(7L, ScheduledTarget.scheduleIdFromKey("backup-schedule:7").getAsLong());
        assertTrue(ScheduledTarget.scheduleIdFromKey("backup-schedule:x").isEmpty());
    }

    @Test
    void failedScheduledJobShouldBeRecordedThroughWorker() {
        InMemoryJobQueue queue = new InMemoryJobQueue(recorder, Clock.fixed(FAILED_AT, ZoneOffset.UTC));
        queue.create(JobTypes.BACKUP_CREATE, BackupRunPayload.scheduled(store.get(1L)))
                .uniqueKey(store.get(1L).uniqueKey())
                .enqueue();
        JobHandler<BackupRunPayload> failing = new JobHandler<>() {
            @Override
            public String type() {
                return JobTypes.BACKUP_CREATE;
            }

            @Override
            public Class<BackupRunPayload> payloadClass() {
                return BackupRunPayload.class;
            }

            @Override
            public String execute(BackupRunPayload payload, JobContext context) {
                throw new IllegalStateException("repository locked: " + payload.repositoryName());
            }
        };
        Worker worker = new Worker(queue, new JobHandlerRegistry(List.of(failing)), new ObjectMapper(),
                new WorkerSettings(Lanes.DEFAULT, "test-worker", Duration.ofMillis(50), Duration.ofSeconds(1)));

        worker.runOnce();

        assertEquals("repository locked: nightly-etc", queue.all().get(0).error());
        assertEquals(RunStatus.FAILURE, store.get(1L).lastStatus());
        assertEquals(Instant.parse("2026-01-06T02:50:00Z"), store.get(1L).nextRunAt());
    }

    private static JobEvent event(JobStatus status, String uniqueKey) {
        return new JobEvent(11L, Lanes.DEFAULT, JobTypes.BACKUP_CREATE, status, 0, null, uniqueKey, FAILED_AT);
    }

    private static ScheduledTarget target(int consecutiveFailures) {
        BackupSchedule schedule = BackupSchedule.builder(ScheduleType.DAILY)
                .id(7)
                .targetId(1)
                .time("02:00")
                .retry(true, 3, 30)
                .build();
        return new ScheduledTarget(1L, "nightly-etc", 2L, 3L, "web-1", true, schedule,
                Instant.parse("2026-01-06T02:00:00Z"), NEXT_RUN, null, consecutiveFailures);
    }
}
