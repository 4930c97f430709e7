package io.borgqueue.internal.mongo;

import io.borgqueue.JobBuilder;
import io.borgqueue.JobQueue;
import io.borgqueue.core.Job;
import io.borgqueue.core.JobEvent;
import io.borgqueue.core.JobEventPublisher;
import io.borgqueue.core.JobSpec;
import io.borgqueue.core.JobStatus;
import io.borgqueue.core.QueueStats;
import io.borgqueue.internal.SimpleJobBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link JobQueue} backed by {@link MongoJobStore}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * long id = jobQueue.create("backup_create", payload)
 *         .queue("default")
 *         .maxAttempts(3)
 *         .enqueue();
 *
 * jobQueue.cancel(id);
 * }</pre>
 *
 * <p>Every progress update and terminal transition is published to the {@link JobEventPublisher}.
 * Publishing is best-effort: failures are logged and never affect the stored job.
 */
public class MongoJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(MongoJobQueue.class);

    private final MongoJobStore jobStore;
    private final JobEventPublisher publisher;
    private final Clock clock;

    public MongoJobQueue(MongoJobStore jobStore, JobEventPublisher publisher, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public <T> JobBuilder<T> create(String type, T payload) {
        return new SimpleJobBuilder<>(type, payload, this::enqueue);
    }

    @Override
    public long enqueue(JobSpec<?> spec) {
        JobDocument doc = jobStore.insert(spec, clock.instant());
        log.info("Enqueued job #{} type={} queue={} uniqueKey={}", doc.getId(), doc.getType(), doc.getQueue(), doc.getUniqueKey());
        return doc.getId();
    }

    @Override
    public long enqueue(String queue, String type, Object payload, int maxAttempts) {
        return create(type, payload).queue(queue).maxAttempts(maxAttempts).enqueue();
    }

    @Override
    public Optional<Job> claimNext(String queue, String workerId) {
        JobDocument doc = jobStore.claimNext(queue, workerId, clock.instant());
        if (doc == null) {
            log.debug("no pending job queue={}", queue);
            return Optional.empty();
        }
        log.debug("claimed job #{} queue={} workerId={}", doc.getId(), queue, workerId);
        return Optional.of(jobStore.toJob(doc));
    }

    @Override
    public void updateProgress(long jobId, int percent, String message) {
        JobDocument doc = jobStore.updateProgress(jobId, percent, message);
        if (doc == null) {
            log.debug("progress ignored for job #{}: not running", jobId);
            return;
        }
        publish(jobStore.toJob(doc), message);
    }

    @Override
    public boolean complete(long jobId, String output) {
        JobDocument doc = jobStore.markCompleted(jobId, output, clock.instant());
        if (doc == null) {
            warnNoop(jobId, JobStatus.COMPLETED);
            return false;
        }
        publish(jobStore.toJob(doc), "Completed");
        return true;
    }

    @Override
    public boolean fail(long jobId, String error) {
        JobDocument doc = jobStore.markFailed(jobId, error, clock.instant());
        if (doc == null) {
            warnNoop(jobId, JobStatus.FAILED);
            return false;
        }
        publish(jobStore.toJob(doc), error);
        return true;
    }

    @Override
    public boolean cancel(long jobId) {
        JobDocument doc = jobStore.markCancelled(jobId, clock.instant());
        if (doc == null) {
            warnNoop(jobId, JobStatus.CANCELLED);
            return false;
        }
        log.info("Cancelled job #{} type={}", jobId, doc.getType());
        publish(jobStore.toJob(doc), "Cancelled");
        return true;
    }

    @Override
    public boolean recordAttempt(long jobId) {
        JobDocument current = jobStore.findById(jobId);
        if (current == null || current.getStatus() != JobStatus.RUNNING) {
            return false;
        }
        if (current.getAttempts() >= current.getMaxAttempts()) {
            return false;
        }
        JobDocument updated = jobStore.incrementAttempts(jobId, current.getAttempts());
        if (updated == null) {
            return false;
        }
        log.info("Job #{} attempt {}/{}", jobId, updated.getAttempts(), updated.getMaxAttempts());
        return updated.getAttempts() < updated.getMaxAttempts();
    }

    @Override
    public OptionalLong resubmit(long jobId) {
        JobDocument failed = jobStore.findById(jobId);
        if (failed == null || !jobStore.toJob(failed).canRetry()) {
            return OptionalLong.empty();
        }
        JobDocument copy = jobStore.insertResubmission(failed, clock.instant());
        log.info("Resubmitted failed job #{} as job #{} (attempts {}/{})",
                jobId, copy.getId(), copy.getAttempts(), copy.getMaxAttempts());
        return OptionalLong.of(copy.getId());
    }

    @Override
    public Optional<Job> findById(long jobId) {
        return Optional.ofNullable(jobStore.findById(jobId)).map(jobStore::toJob);
    }

    @Override
    public List<Job> findRecent(int limit) {
        return jobStore.findRecent(limit).stream().map(jobStore::toJob).toList();
    }

    @Override
    public boolean hasActiveJob(String uniqueKey) {
        if (uniqueKey == null || uniqueKey.isBlank()) {
            return false;
        }
        return jobStore.existsActiveByUniqueKey(uniqueKey);
    }

    @Override
    public QueueStats stats() {
        return jobStore.countByStatus();
    }

    @Override
    public long purgeFinishedBefore(Instant before) {
        return jobStore.deleteFinishedBefore(before);
    }

    private void warnNoop(long jobId, JobStatus target) {
        JobDocument current = jobStore.findById(jobId);
        log.warn("Ignored transition of job #{} to {}: current status {}",
                jobId, target, current != null ? current.getStatus() : "unknown");
    }

    private void publish(Job job, String message) {
        try {
            publisher.publish(JobEvent.of(job, message, clock.instant()));
        } catch (Exception e) {
            log.warn("job event publish failed jobId={} status={} msg={}", job.id(), job.status(), e.getMessage());
        }
    }
}
