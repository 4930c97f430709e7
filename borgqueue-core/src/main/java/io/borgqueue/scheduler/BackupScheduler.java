package io.borgqueue.scheduler;

import io.borgqueue.JobQueue;
import io.borgqueue.schedule.BackupSchedule;
import io.borgqueue.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides when recurring backups become due and enqueues them.
 *
 * <p>One coarse tick loop, independent of workers:
 * <ul>
 *   <li>every {@code tickInterval}: evaluate every enabled schedule ({@link #tick(Instant)})</li>
 *   <li>every {@code maintenanceInterval}: enqueue stats collection and purge old jobs
 *       ({@link #maintenanceTick(Instant)})</li>
 * </ul>
 *
 * <p>Several scheduler processes may run against the same store: a run is only enqueued by the
 * process that wins the compare-and-set on the target's {@code nextRunAt}, and never while a
 * job with the schedule's key is still pending or running.
 */
public class BackupScheduler {
    private static final Logger log = LoggerFactory.getLogger(BackupScheduler.class);

    private final JobQueue queue;
    private final ScheduleStore scheduleStore;
    private final List<MaintenanceTaskSource> maintenanceSources;
    private final SchedulerSettings settings;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private Thread tickThread;

    private Instant lastMaintenanceAt;
    private int systemErrorCount = 0;

    public BackupScheduler(JobQueue queue,
                           ScheduleStore scheduleStore,
                           List<MaintenanceTaskSource> maintenanceSources,
                           SchedulerSettings settings,
                           Clock clock) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.maintenanceSources = List.copyOf(Objects.requireNonNull(maintenanceSources, "maintenanceSources must not be null"));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the tick loop. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Backup scheduler starting with tickInterval={}, maintenanceInterval={}, backupLane={}",
                settings.tickInterval(), settings.maintenanceInterval(), settings.backupLane());

        stopSignal = new CountDownLatch(1);
        tickThread = new Thread(this::tickLoop);
        tickThread.setName("borgqueue.scheduler");
        tickThread.setDaemon(false);
        tickThread.start();
    }

    /**
     * Stop the tick loop after the current tick. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Backup scheduler stopping...");
        stopSignal.countDown();

        Thread t = tickThread;
        tickThread = null;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(settings.tickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Backup scheduler stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    private void tickLoop() {
        while (started.get()) {
            Duration sleep = settings.tickInterval();
            try {
                Instant now = clock.instant();
                tick(now);
                if (lastMaintenanceAt == null
                        || !now.isBefore(lastMaintenanceAt.plus(settings.maintenanceInterval()))) {
                    maintenanceTick(now);
                    lastMaintenanceAt = now;
                }
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("scheduler tick failed msg={}", e.getMessage(), e);
                sleep = backoff(systemErrorCount);
            }

            try {
                if (stopSignal.await(sleep.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures, never longer than one tick.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), settings.tickInterval().toMillis());
        return Duration.ofMillis(ms);
    }

    /**
     * Evaluates every enabled schedule once.
     *
     * @return number of backup jobs enqueued
     */
    public int tick(Instant now) {
        List<ScheduledTarget> targets = scheduleStore.findEnabled();
        log.debug("Schedule check: found {} enabled target(s)", targets.size());

        int enqueued = 0;
        for (ScheduledTarget target : targets) {
            try {
                if (evaluate(target, now)) {
                    enqueued++;
                }
            } catch (Exception e) {
                log.error("scheduler failed to evaluate target id={} name={} msg={}",
                        target.targetId(), target.name(), e.getMessage(), e);
            }
        }
        if (enqueued > 0) {
            log.info("Schedule check queued {} backup job(s)", enqueued);
        }
        return enqueued;
    }

    private boolean evaluate(ScheduledTarget target, Instant now) {
        BackupSchedule schedule = target.schedule();
        if (schedule == null) {
            return false;
        }

        if (target.nextRunAt() == null) {
            var first = ScheduleCalculator.nextRun(schedule, now);
            if (first.isEmpty()) {
                log.debug("schedule has no computable next run targetId={} type={}", target.targetId(), schedule.type());
                return false;
            }
            scheduleStore.reschedule(target.targetId(), null, first.get());
            log.info("Initialised next run of target id={} name={} nextRunAt={}", target.targetId(), target.name(), first.get());
            return false;
        }

        if (!target.isDue(now)) {
            return false;
        }

        if (schedule.isInBlackout(now)) {
            log.debug("target id={} is due but inside a blackout period", target.targetId());
            return false;
        }
        if (!schedule.isWithinWindow(now)) {
            log.debug("target id={} is due but outside its window {}-{}",
                    target.targetId(), schedule.windowStart(), schedule.windowEnd());
            return false;
        }

        Instant next = ScheduleCalculator.nextRun(schedule, now).orElse(null);

        if (queue.hasActiveJob(target.uniqueKey())) {
            log.warn("Skipping run of target id={} name={}: previous job still active, nextRunAt={}",
                    target.targetId(), target.name(), next);
            scheduleStore.reschedule(target.targetId(), target.nextRunAt(), next);
            return false;
        }

        if (!scheduleStore.claimRun(target.targetId(), target.nextRunAt(), now, next)) {
            log.debug("run slot of target id={} already taken by another scheduler", target.targetId());
            return false;
        }

        try {
            long jobId = queue.create(JobTypes.BACKUP_CREATE, BackupRunPayload.scheduled(target))
                    .queue(settings.backupLane())
                    .maxAttempts(settings.backupMaxAttempts())
                    .uniqueKey(target.uniqueKey())
                    .enqueue();
            log.info("Queued backup target id={} name={} as job #{} nextRunAt={}",
                    target.targetId(), target.name(), jobId, next);
            return true;
        } catch (RuntimeException e) {
            scheduleStore.recordOutcome(target.targetId(), RunStatus.FAILURE);
            throw e;
        }
    }

    /**
     * Enqueues maintenance jobs that are not already active and purges old finished jobs.
     *
     * @return number of maintenance jobs enqueued
     */
    public int maintenanceTick(Instant now) {
        log.info("Starting periodic maintenance");
        int enqueued = 0;
        int skipped = 0;

        for (MaintenanceTaskSource source : maintenanceSources) {
            List<MaintenanceTask> tasks;
            try {
                tasks = source.tasks();
            } catch (Exception e) {
                log.error("maintenance source failed source={} msg={}", source.getClass().getSimpleName(), e.getMessage(), e);
                continue;
            }

            for (MaintenanceTask task : tasks) {
                try {
                    if (queue.hasActiveJob(task.uniqueKey())) {
                        skipped++;
                        continue;
                    }
                    queue.create(task.type(), task.payload())
                            .queue(settings.backupLane())
                            .maxAttempts(settings.maintenanceMaxAttempts())
                            .uniqueKey(task.uniqueKey())
                            .enqueue();
                    enqueued++;
                } catch (Exception e) {
                    log.error("failed to queue maintenance job type={} key={} msg={}",
                            task.type(), task.uniqueKey(), e.getMessage());
                }
            }
        }

        Duration retention = settings.jobRetention();
        if (retention != null && !retention.isZero() && !retention.isNegative()) {
            try {
                long purged = queue.purgeFinishedBefore(now.minus(retention));
                if (purged > 0) {
                    log.info("Purged {} finished job(s) older than {}", purged, retention);
                }
            } catch (Exception e) {
                log.error("failed to purge finished jobs msg={}", e.getMessage(), e);
            }
        }

        log.info("Maintenance queued {} job(s), skipped {} still active", enqueued, skipped);
        return enqueued;
    }
}
