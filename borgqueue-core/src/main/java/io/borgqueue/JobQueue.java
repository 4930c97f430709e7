package io.borgqueue;

import io.borgqueue.core.Job;
import io.borgqueue.core.JobSpec;
import io.borgqueue.core.QueueStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable job queue shared by producers, workers and the scheduler.
 *
 * <p>All coordination happens in the store through conditional updates:
 * <ul>
 *   <li>{@link #claimNext} hands a pending job to exactly one caller</li>
 *   <li>terminal transitions only apply to jobs that are not already terminal</li>
 *   <li>a cancelled job is never moved back to running or overwritten by a late worker</li>
 * </ul>
 */
public interface JobQueue {

    <T> JobBuilder<T> create(String type, T payload);

    long enqueue(JobSpec<?> spec);

    long enqueue(String queue, String type, Object payload, int maxAttempts);

    /**
     * Atomically moves the oldest pending job of {@code queue} to running and increments its
     * attempts.
     */
    Optional<Job> claimNext(String queue, String workerId);

    /**
     * Advisory progress update. Percent is clamped to 0..100.
     */
    void updateProgress(long jobId, int percent, String message);

    /**
     * @return false when the job was not running (already terminal or unknown)
     */
    boolean complete(long jobId, String output);

    /**
     * @return false when the job was not running (already terminal or unknown)
     */
    boolean fail(long jobId, String error);

    /**
     * Cancels a pending or running job. Running jobs stop cooperatively.
     *
     * @return false when the job was already terminal or unknown
     */
    boolean cancel(long jobId);

    /**
     * Same-record retry bookkeeping for a running job: increments attempts.
     *
     * @return true while attempts stay below maxAttempts
     */
    boolean recordAttempt(long jobId);

    /**
     * Submits a failed job again as a new pending record that carries over its attempts.
     */
    OptionalLong resubmit(long jobId);

    Optional<Job> findById(long jobId);

    List<Job> findRecent(int limit);

    /**
     * True if a pending or running job carries {@code uniqueKey}.
     */
    boolean hasActiveJob(String uniqueKey);

    QueueStats stats();

    /**
     * Deletes terminal jobs that completed before {@code before}.
     *
     * @return deleted count
     */
    long purgeFinishedBefore(Instant before);
}
