package io.borgqueue.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.borgqueue.core.Job;
import io.borgqueue.core.JobSpec;
import io.borgqueue.core.JobStatus;
import io.borgqueue.core.QueueStats;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Every state transition is a single conditional {@code findAndModify}; the status filter in
 * the query is what makes a transition legal:
 * <ul>
 *   <li>claim: {@code PENDING -> RUNNING}, oldest id first</li>
 *   <li>complete / fail: only from {@code RUNNING}</li>
 *   <li>cancel: from {@code PENDING} or {@code RUNNING}</li>
 * </ul>
 * A method returns {@code null} when its filter matched nothing.
 */
public class MongoJobStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final MongoSequenceGenerator sequenceGenerator;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, MongoSequenceGenerator sequenceGenerator) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.sequenceGenerator = Objects.requireNonNull(sequenceGenerator, "sequenceGenerator must not be null");
    }

    /**
     * Insert a new pending job.
     */
    public <T> JobDocument insert(JobSpec<T> spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");

        JobDocument doc = new JobDocument();
        doc.setId(sequenceGenerator.next(MongoSequenceGenerator.JOBS_SEQUENCE));
        doc.setQueue(spec.queue());
        doc.setType(spec.type());
        doc.setPayload(toPayloadMap(spec.payload()));
        doc.setStatus(JobStatus.PENDING);
        doc.setMaxAttempts(spec.maxAttempts());
        doc.setCreatedAt(now);
        doc.setCreatedBy(spec.createdBy());
        doc.setUniqueKey(spec.uniqueKey());
        return mongoTemplate.insert(doc);
    }

    /**
     * Copy of a failed job as a new pending record. Attempts are carried over.
     */
    public JobDocument insertResubmission(JobDocument failed, Instant now) {
        JobDocument doc = new JobDocument();
        doc.setId(sequenceGenerator.next(MongoSequenceGenerator.JOBS_SEQUENCE));
        doc.setQueue(failed.getQueue());
        doc.setType(failed.getType());
        doc.setPayload(failed.getPayload());
        doc.setStatus(JobStatus.PENDING);
        doc.setAttempts(failed.getAttempts());
        doc.setMaxAttempts(failed.getMaxAttempts());
        doc.setCreatedAt(now);
        doc.setCreatedBy(failed.getCreatedBy());
        doc.setUniqueKey(failed.getUniqueKey());
        return mongoTemplate.insert(doc);
    }

    /**
     * Atomically claims the oldest pending job of {@code queue}.
     *
     * <p>Safe under concurrent workers in separate processes: the status filter and the update are
     * applied by MongoDB as one operation on a single document.
     */
    public JobDocument claimNext(String queue, String workerId, Instant now) {
        Objects.requireNonNull(queue, "queue must not be null");
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query q = new Query(
                Criteria.where("queue").is(queue)
                        .and("status").is(JobStatus.PENDING)
        ).with(Sort.by(Sort.Order.asc("_id")));

        Update u = new Update()
                .set("status", JobStatus.RUNNING)
                .set("startedAt", now)
                .set("workerId", workerId)
                .inc("attempts", 1);

        return mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), JobDocument.class);
    }

    public JobDocument updateProgress(long id, int percent, String message) {
        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("status").is(JobStatus.RUNNING)
        );
        Update u = new Update()
                .set("progress", Math.max(0, Math.min(100, percent)))
                .set("progressMessage", message);

        return mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), JobDocument.class);
    }

    public JobDocument markCompleted(long id, String output, Instant finishedAt) {
        Update u = new Update()
                .set("status", JobStatus.COMPLETED)
                .set("output", output)
                .set("progress", 100)
                .set("completedAt", finishedAt);
        return transition(id, List.of(JobStatus.RUNNING), u);
    }

    public JobDocument markFailed(long id, String error, Instant finishedAt) {
        Update u = new Update()
                .set("status", JobStatus.FAILED)
                .set("error", error)
                .set("completedAt", finishedAt);
        return transition(id, List.of(JobStatus.RUNNING), u);
    }

    public JobDocument markCancelled(long id, Instant cancelledAt) {
        Update u = new Update()
                .set("status", JobStatus.CANCELLED)
                .set("completedAt", cancelledAt);
        return transition(id, List.of(JobStatus.PENDING, JobStatus.RUNNING), u);
    }

    private JobDocument transition(long id, List<JobStatus> from, Update u) {
        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("status").in(from)
        );
        return mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), JobDocument.class);
    }

    /**
     * Increments attempts of a running job if it still has {@code expectedAttempts}.
     */
    public JobDocument incrementAttempts(long id, int expectedAttempts) {
        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("status").is(JobStatus.RUNNING)
                        .and("attempts").is(expectedAttempts)
        );
        return mongoTemplate.findAndModify(q, new Update().inc("attempts", 1),
                FindAndModifyOptions.options().returnNew(true), JobDocument.class);
    }

    public JobDocument findById(long id) {
        return mongoTemplate.findById(id, JobDocument.class);
    }

    public List<JobDocument> findRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query().with(Sort.by(Sort.Order.desc("_id"))).limit(limit);
        return mongoTemplate.find(q, JobDocument.class);
    }

    public boolean existsActiveByUniqueKey(String uniqueKey) {
        Query q = new Query(
                Criteria.where("uniqueKey").is(uniqueKey)
                        .and("status").in(JobStatus.PENDING, JobStatus.RUNNING)
        );
        return mongoTemplate.exists(q, JobDocument.class);
    }

    public QueueStats countByStatus() {
        Aggregation agg = Aggregation.newAggregation(Aggregation.group("status").count().as("count"));
        AggregationResults<Document> results = mongoTemplate.aggregate(agg, JobDocument.class, Document.class);

        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (Document row : results.getMappedResults()) {
            Object status = row.get("_id");
            Number count = row.get("count", Number.class);
            if (status != null && count != null) {
                counts.put(JobStatus.valueOf(status.toString()), count.longValue());
            }
        }
        return new QueueStats(
                counts.getOrDefault(JobStatus.PENDING, 0L),
                counts.getOrDefault(JobStatus.RUNNING, 0L),
                counts.getOrDefault(JobStatus.COMPLETED, 0L),
                counts.getOrDefault(JobStatus.FAILED, 0L),
                counts.getOrDefault(JobStatus.CANCELLED, 0L)
        );
    }

    /**
     * Hard delete terminal jobs finished before {@code before}.
     *
     * @return deleted count
     */
    public long deleteFinishedBefore(Instant before) {
        Objects.requireNonNull(before, "before must not be null");
        Query q = new Query(
                Criteria.where("status").in(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED)
                        .and("completedAt").lt(before)
        );
        return mongoTemplate.remove(q, JobDocument.class).getDeletedCount();
    }

    /**
     * Converts a persisted {@link JobDocument} into the immutable {@link Job} view.
     */
    public Job toJob(JobDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        return new Job(
                doc.getId(),
                doc.getQueue(),
                doc.getType(),
                doc.getPayload(),
                doc.getStatus(),
                doc.getProgress(),
                doc.getProgressMessage(),
                doc.getAttempts(),
                doc.getMaxAttempts(),
                doc.getOutput(),
                doc.getError(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getCreatedAt(),
                doc.getCreatedBy(),
                doc.getUniqueKey(),
                doc.getWorkerId()
        );
    }

    private Map<String, Object> toPayloadMap(Object payload) {
        if (payload == null) {
            return Map.of();
        }
        return objectMapper.convertValue(payload, MAP_TYPE);
    }
}
