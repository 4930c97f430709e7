package io.borgqueue.config;

import io.borgqueue.internal.mongo.BackupScheduleDocument;
import io.borgqueue.internal.mongo.BackupTargetDocument;
import io.borgqueue.internal.mongo.JobDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MongoDB index definitions for the job queue and the backup scheduler.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically unless
 * {@code borgqueue.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migration scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_claim</b> on {@code jobs}: { queue: 1, status: 1, _id: 1 }
 *       <br/>Used by workers claiming the oldest pending job of a lane.</li>
 *   <li><b>idx_uniqueKey_status</b> on {@code jobs}: { uniqueKey: 1, status: 1 }, partial on
 *       {@code uniqueKey} existing
 *       <br/>Used by the scheduler's duplicate-enqueue guard.</li>
 *   <li><b>idx_status_completedAt</b> on {@code jobs}: { status: 1, completedAt: 1 }
 *       <br/>Used by the purge of old finished jobs.</li>
 *   <li><b>idx_enabled_server</b> on {@code backup_jobs}: { enabled: 1, serverId: 1 }
 *       <br/>Used by the schedule tick and server stats maintenance.</li>
 *   <li><b>ux_schedule_job</b> (unique) on {@code backup_schedules}: { jobId: 1 }
 *       <br/>One schedule per backup target.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ queue: 1, status: 1, _id: 1 }, { name: "idx_claim" });
 * db.jobs.createIndex(
 *   { uniqueKey: 1, status: 1 },
 *   { name: "idx_uniqueKey_status", partialFilterExpression: { uniqueKey: { $exists: true } } }
 * );
 * db.jobs.createIndex({ status: 1, completedAt: 1 }, { name: "idx_status_completedAt" });
 * db.backup_jobs.createIndex({ enabled: 1, serverId: 1 }, { name: "idx_enabled_server" });
 * db.backup_schedules.createIndex({ jobId: 1 }, { name: "ux_schedule_job", unique: true });
 * </pre>
 */
public class BorgQueueMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(BorgQueueMongoIndexConfig.class);

    public static final String IDX_CLAIM = "idx_claim";
    public static final String IDX_UNIQUE_KEY_STATUS = "idx_uniqueKey_status";
    public static final String IDX_STATUS_COMPLETED_AT = "idx_status_completedAt";
    public static final String IDX_ENABLED_SERVER = "idx_enabled_server";
    public static final String UX_SCHEDULE_JOB = "ux_schedule_job";

    private final MongoTemplate mongoTemplate;

    public BorgQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Ensure all required indexes. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(claimIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(uniqueKeyStatusIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(statusCompletedAtIndex());
        mongoTemplate.indexOps(BackupTargetDocument.class).ensureIndex(enabledServerIndex());
        mongoTemplate.indexOps(BackupScheduleDocument.class).ensureIndex(scheduleJobUniqueIndex());
        log.info("borgqueue indexes ensured");
    }

    public static Index claimIndex() {
        return new Index()
                .on("queue", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .on("_id", Sort.Direction.ASC)
                .named(IDX_CLAIM);
    }

    public static Index uniqueKeyStatusIndex() {
        return new Index()
                .on("uniqueKey", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .partial(PartialIndexFilter.of(new Document("uniqueKey", new Document("$exists", true))))
                .named(IDX_UNIQUE_KEY_STATUS);
    }

    public static Index statusCompletedAtIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("completedAt", Sort.Direction.ASC)
                .named(IDX_STATUS_COMPLETED_AT);
    }

    public static Index enabledServerIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("serverId", Sort.Direction.ASC)
                .named(IDX_ENABLED_SERVER);
    }

    public static Index scheduleJobUniqueIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .unique()
                .named(UX_SCHEDULE_JOB);
    }
}
