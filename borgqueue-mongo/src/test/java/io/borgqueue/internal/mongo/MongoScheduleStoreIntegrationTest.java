package io.borgqueue.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.borgqueue.core.CompositeJobEventPublisher;
import io.borgqueue.core.Job;
import io.borgqueue.core.JobEventPublisher;
import io.borgqueue.core.JobStatus;
import io.borgqueue.core.Lanes;
import io.borgqueue.schedule.BackupSchedule;
import io.borgqueue.schedule.ScheduleType;
import io.borgqueue.scheduler.BackupScheduler;
import io.borgqueue.scheduler.JobTypes;
import io.borgqueue.scheduler.MaintenanceTask;
import io.borgqueue.scheduler.RunStatus;
import io.borgqueue.scheduler.ScheduleOutcomeRecorder;
import io.borgqueue.scheduler.ScheduledTarget;
import io.borgqueue.scheduler.SchedulerSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoScheduleStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // 2026-01-06 is a Tuesday
    private static final Instant NOW = Instant.parse("2026-01-06T02:01:00Z");
    private static final Instant DUE = Instant.parse("2026-01-06T02:00:00Z");
    private static final Instant TOMORROW = Instant.parse("2026-01-07T02:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoScheduleStore store;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "borgqueue_test");
        dropCollections();
        store = new MongoScheduleStore(mongoTemplate, clock);
    }

    @AfterEach
    void tearDown() {
        dropCollections();
    }

    @Test
    void savedScheduleShouldBeJoinedWithItsTarget() {
        store.saveTarget(target(1L, 3L, true));
        store.saveSchedule(BackupSchedule.builder(ScheduleType.WEEKLY)
                .id(7)
                .targetId(1)
                .time("02:00")
                .timezone("Europe/Berlin")
                .weekdays(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)
                .window(LocalTime.of(1, 0), LocalTime.of(5, 0))
                .blackout(Instant.parse("2026-02-01T00:00:00Z"), Instant.parse("2026-02-02T00:00:00Z"))
                .build());

        List<ScheduledTarget> enabled = store.findEnabled();

        assertEquals(1, enabled.size());
        ScheduledTarget t = enabled.get(0);
        assertEquals("nightly-etc", t.name());
        assertEquals(ScheduleType.WEEKLY, t.schedule().type());
        assertEquals(17, t.schedule().weekdays());
        assertEquals(LocalTime.of(2, 0), t.schedule().time());
        assertEquals(LocalTime.of(5, 0), t.schedule().windowEnd());
        assertEquals(1, t.schedule().blackoutPeriods().size());
        // Friday 02:00 Berlin
        assertEquals(Instant.parse("2026-01-09T01:00:00Z"), t.nextRunAt());
        assertEquals(t, store.findByScheduleId(7L).orElseThrow());
    }

    @Test
    void invalidScheduleShouldBeRejected() {
        store.saveTarget(target(1L, 3L, true));

        assertThrows(IllegalArgumentException.class, () -> store.saveSchedule(
                BackupSchedule.builder(ScheduleType.WEEKLY).id(7).targetId(1).time("02:00").weekdays(0).build()));
        assertTrue(store.findEnabled().isEmpty());
    }

    @Test
    void disabledTargetsAndTargetsWithoutScheduleShouldBeSkipped() {
        store.saveTarget(target(1L, 3L, false));
        store.saveTarget(target(2L, 3L, true));
        store.saveSchedule(daily(7, 1));

        assertTrue(store.findEnabled().isEmpty());
    }

    @Test
    void claimRunShouldOnlySucceedOncePerSlot() {
        BackupTargetDocument doc = target(1L, 3L, true);
        doc.setNextRunAt(DUE);
        store.saveTarget(doc);

        assertTrue(store.claimRun(1L, DUE, NOW, TOMORROW));
        assertFalse(store.claimRun(1L, DUE, NOW, TOMORROW));

        BackupTargetDocument stored = store.findTarget(1L).orElseThrow();
        assertEquals(TOMORROW, stored.getNextRunAt());
        assertEquals(NOW, stored.getLastRunAt());
        assertEquals(RunStatus.RUNNING, stored.getLastStatus());
        assertEquals(1, stored.getTotalRuns());
    }

    @Test
    void rescheduleShouldMatchUnsetNextRun() {
        store.saveTarget(target(1L, 3L, true));

        assertTrue(store.reschedule(1L, null, TOMORROW));
        assertFalse(store.reschedule(1L, null, DUE));
        assertEquals(TOMORROW, store.findTarget(1L).orElseThrow().getNextRunAt());
    }

    @Test
    void retryShouldOnlyPullNextRunForward() {
        BackupTargetDocument doc = target(1L, 3L, true);
        doc.setNextRunAt(TOMORROW);
        store.saveTarget(doc);

        Instant retryAt = NOW.plusSeconds(1800);
        store.pullNextRunForward(1L, retryAt);
        assertEquals(retryAt, store.findTarget(1L).orElseThrow().getNextRunAt());

        store.pullNextRunForward(1L, TOMORROW.plusSeconds(3600));
        assertEquals(retryAt, store.findTarget(1L).orElseThrow().getNextRunAt());
    }

    @Test
    void retryShouldNotScheduleUnsetTarget() {
        store.saveTarget(target(1L, 3L, true));

        store.pullNextRunForward(1L, NOW.plusSeconds(1800));

        assertNull(store.findTarget(1L).orElseThrow().getNextRunAt());
    }

    @Test
    void outcomeShouldCountFailuresInTheStore() {
        store.saveTarget(target(1L, 3L, true));

        assertEquals(OptionalInt.of(1), store.recordOutcome(1L, RunStatus.FAILURE));
        assertEquals(OptionalInt.of(2), store.recordOutcome(1L, RunStatus.FAILURE));
        assertEquals(OptionalInt.of(2), store.recordOutcome(1L, RunStatus.CANCELLED));
        assertEquals(RunStatus.CANCELLED, store.findTarget(1L).orElseThrow().getLastStatus());

        assertEquals(OptionalInt.of(0), store.recordOutcome(1L, RunStatus.SUCCESS));
        BackupTargetDocument stored = store.findTarget(1L).orElseThrow();
        assertEquals(0, stored.getConsecutiveFailures());
        assertEquals(RunStatus.SUCCESS, stored.getLastStatus());

        assertTrue(store.recordOutcome(99L, RunStatus.FAILURE).isEmpty());
    }

    @Test
    void concurrentFailuresShouldAllBeCounted() throws Exception {
        store.saveTarget(target(1L, 3L, true));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<OptionalInt>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> store.recordOutcome(1L, RunStatus.FAILURE)));
            }
            for (Future<OptionalInt> r : results) {
                r.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(8, store.findTarget(1L).orElseThrow().getConsecutiveFailures());
    }

    @Test
    void disablingTargetShouldClearNextRun() {
        store.saveTarget(target(1L, 3L, true));
        store.saveSchedule(daily(7, 1));
        assertEquals(TOMORROW, store.findTarget(1L).orElseThrow().getNextRunAt());

        assertTrue(store.setEnabled(1L, false));

        BackupTargetDocument stored = store.findTarget(1L).orElseThrow();
        assertFalse(stored.isEnabled());
        assertNull(stored.getNextRunAt());
        assertTrue(store.findEnabled().isEmpty());

        assertTrue(store.setEnabled(1L, true));
        ScheduledTarget reenabled = store.findEnabled().get(0);
        assertNull(reenabled.nextRunAt());
        assertFalse(store.setEnabled(99L, true));
    }

    @Test
    void serverStatsShouldCoverEachServerOnce() {
        store.saveTarget(target(1L, 3L, true));
        store.saveTarget(target(2L, 3L, true));
        store.saveTarget(target(3L, 5L, true));
        store.saveTarget(target(4L, 9L, false));

        List<MaintenanceTask> tasks = new ServerStatsTaskSource(mongoTemplate).tasks();

        assertEquals(List.of("server-stats:3", "server-stats:5"),
                tasks.stream().map(MaintenanceTask::uniqueKey).toList());
        assertEquals(JobTypes.SERVER_STATS_COLLECT, tasks.get(0).type());
        assertEquals(3L, tasks.get(0).payload().get("server_id"));
    }

    @Test
    void schedulerShouldEnqueueOnceAndRecordOutcome() {
        BackupTargetDocument doc = target(1L, 3L, true);
        store.saveTarget(doc);
        store.saveSchedule(daily(7, 1));
        store.reschedule(1L, TOMORROW, DUE);

        MongoJobStore jobStore = new MongoJobStore(mongoTemplate, new ObjectMapper(), new MongoSequenceGenerator(mongoTemplate));
        JobEventPublisher publisher = new CompositeJobEventPublisher(List.of(new ScheduleOutcomeRecorder(store)));
        MongoJobQueue queue = new MongoJobQueue(jobStore, publisher, clock);
        BackupScheduler scheduler = new BackupScheduler(queue, store, List.of(), SchedulerSettings.defaults(), clock);
        BackupScheduler competitor = new BackupScheduler(queue, store, List.of(), SchedulerSettings.defaults(), clock);

        assertEquals(1, scheduler.tick(NOW));
        assertEquals(0, competitor.tick(NOW));

        Job job = queue.claimNext(Lanes.DEFAULT, "worker-a").orElseThrow();
        assertEquals("backup-schedule:7", job.uniqueKey());
        assertEquals(JobTypes.BACKUP_CREATE, job.type());
        queue.fail(job.id(), "borg: repository is locked");

        BackupTargetDocument stored = store.findTarget(1L).orElseThrow();
        assertEquals(RunStatus.FAILURE, stored.getLastStatus());
        assertEquals(1, stored.getConsecutiveFailures());
        assertEquals(NOW.plusSeconds(30 * 60), stored.getNextRunAt());
        assertEquals(JobStatus.FAILED, queue.findById(job.id()).orElseThrow().status());
    }

    private void dropCollections() {
        mongoTemplate.dropCollection(BackupTargetDocument.class);
        mongoTemplate.dropCollection(BackupScheduleDocument.class);
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(SequenceDocument.class);
    }

    private static BackupSchedule daily(long scheduleId, long targetId) {
        return BackupSchedule.builder(ScheduleType.DAILY)
                .id(scheduleId)
                .targetId(targetId)
                .time("02:00")
                .build();
    }

    private static BackupTargetDocument target(long id, long serverId, boolean enabled) {
        BackupTargetDocument doc = new BackupTargetDocument();
        doc.setId(id);
        doc.setName("nightly-etc");
        doc.setRepositoryId(2L);
        doc.setServerId(serverId);
        doc.setServerName("web-" + serverId);
        doc.setEnabled(enabled);
        return doc;
    }
}
