package io.borgqueue.internal.mongo;

import io.borgqueue.schedule.BackupSchedule;
import io.borgqueue.schedule.ScheduleCalculator;
import io.borgqueue.schedule.ScheduleValidator;
import io.borgqueue.scheduler.RunStatus;
import io.borgqueue.scheduler.ScheduleStore;
import io.borgqueue.scheduler.ScheduledTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link ScheduleStore} over the {@code backup_jobs} and {@code backup_schedules} collections.
 *
 * <p>Run bookkeeping lives on the target document. Updates that decide whether a run happens
 * filter on the {@code nextRunAt} value the caller last read, so only one scheduler process can
 * move a given slot.
 */
public class MongoScheduleStore implements ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(MongoScheduleStore.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoScheduleStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<ScheduledTarget> findEnabled() {
        List<BackupTargetDocument> targets = mongoTemplate.find(
                new Query(Criteria.where("enabled").is(true)), BackupTargetDocument.class);
        if (targets.isEmpty()) {
            return List.of();
        }

        List<Long> ids = targets.stream().map(BackupTargetDocument::getId).toList();
        Map<Long, BackupScheduleDocument> schedulesByTarget = mongoTemplate.find(
                        new Query(Criteria.where("jobId").in(ids)), BackupScheduleDocument.class)
                .stream()
                .collect(Collectors.toMap(BackupScheduleDocument::getJobId, Function.identity(), (a, b) -> a));

        List<ScheduledTarget> result = new ArrayList<>(targets.size());
        for (BackupTargetDocument target : targets) {
            BackupScheduleDocument schedule = schedulesByTarget.get(target.getId());
            if (schedule == null) {
                continue;
            }
            toScheduledTarget(target, schedule).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public Optional<ScheduledTarget> findByScheduleId(long scheduleId) {
        BackupScheduleDocument schedule = mongoTemplate.findById(scheduleId, BackupScheduleDocument.class);
        if (schedule == null || schedule.getJobId() == null) {
            return Optional.empty();
        }
        BackupTargetDocument target = mongoTemplate.findById(schedule.getJobId(), BackupTargetDocument.class);
        if (target == null) {
            return Optional.empty();
        }
        return toScheduledTarget(target, schedule);
    }

    @Override
    public boolean reschedule(long targetId, Instant expectedNextRunAt, Instant nextRunAt) {
        Update u = new Update().set("nextRunAt", nextRunAt);
        return mongoTemplate.updateFirst(slot(targetId, expectedNextRunAt), u, BackupTargetDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean claimRun(long targetId, Instant expectedNextRunAt, Instant ranAt, Instant nextRunAt) {
        Update u = new Update()
                .set("lastRunAt", ranAt)
                .set("nextRunAt", nextRunAt)
                .set("lastStatus", RunStatus.RUNNING)
                .inc("totalRuns", 1);
        return mongoTemplate.updateFirst(slot(targetId, expectedNextRunAt), u, BackupTargetDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public OptionalInt recordOutcome(long targetId, RunStatus status) {
        Update u = new Update().set("lastStatus", status);
        if (status == RunStatus.SUCCESS) {
            u.set("consecutiveFailures", 0);
        } else if (status == RunStatus.FAILURE) {
            u.inc("consecutiveFailures", 1);
        }
        BackupTargetDocument doc = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(targetId)), u,
                FindAndModifyOptions.options().returnNew(true), BackupTargetDocument.class);
        if (doc == null) {
            log.warn("outcome not recorded: backup target id={} not found", targetId);
            return OptionalInt.empty();
        }
        return OptionalInt.of(doc.getConsecutiveFailures());
    }

    @Override
    public void pullNextRunForward(long targetId, Instant retryAt) {
        Objects.requireNonNull(retryAt, "retryAt must not be null");
        // $min keeps the earlier of the regular next run and the retry; null sorts first and stays
        mongoTemplate.updateFirst(
                new Query(Criteria.where("_id").is(targetId)),
                new Update().min("nextRunAt", retryAt),
                BackupTargetDocument.class
        );
    }

    /**
     * Validates and stores a schedule, then recomputes the next run of its target.
     *
     * @throws IllegalArgumentException when the schedule is invalid
     */
    public BackupSchedule saveSchedule(BackupSchedule schedule) {
        ScheduleValidator.requireValid(schedule);

        mongoTemplate.save(BackupScheduleDocument.from(schedule));

        Instant next = ScheduleCalculator.nextRun(schedule, clock.instant()).orElse(null);
        mongoTemplate.updateFirst(
                new Query(Criteria.where("_id").is(schedule.targetId())),
                new Update().set("nextRunAt", next),
                BackupTargetDocument.class
        );
        log.info("Saved {} schedule id={} for target id={} nextRunAt={}",
                schedule.type().value(), schedule.id(), schedule.targetId(), next);
        return schedule;
    }

    public BackupTargetDocument saveTarget(BackupTargetDocument target) {
        return mongoTemplate.save(target);
    }

    public Optional<BackupTargetDocument> findTarget(long targetId) {
        return Optional.ofNullable(mongoTemplate.findById(targetId, BackupTargetDocument.class));
    }

    /**
     * Enable or disable a target. Disabling clears {@code nextRunAt}; enabling leaves it unset so
     * the next tick initialises it.
     */
    public boolean setEnabled(long targetId, boolean enabled) {
        Update u = new Update().set("enabled", enabled);
        if (!enabled) {
            u.set("nextRunAt", null);
        }
        BackupTargetDocument doc = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(targetId)), u,
                FindAndModifyOptions.options().returnNew(true), BackupTargetDocument.class);
        return doc != null;
    }

    private static Query slot(long targetId, Instant expectedNextRunAt) {
        // null matches both a missing and an explicit null field
        return new Query(Criteria.where("_id").is(targetId).and("nextRunAt").is(expectedNextRunAt));
    }

    private static Optional<ScheduledTarget> toScheduledTarget(BackupTargetDocument target, BackupScheduleDocument scheduleDoc) {
        BackupSchedule schedule;
        try {
            schedule = scheduleDoc.toSchedule();
        } catch (RuntimeException e) {
            log.warn("unreadable schedule id={} targetId={} msg={}", scheduleDoc.getId(), target.getId(), e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new ScheduledTarget(
                target.getId(),
                target.getName(),
                target.getRepositoryId(),
                target.getServerId(),
                target.getServerName(),
                target.isEnabled(),
                schedule,
                target.getLastRunAt(),
                target.getNextRunAt(),
                target.getLastStatus(),
                target.getConsecutiveFailures()
        ));
    }
}
