package io.borgqueue;

import io.borgqueue.core.Job;
import io.borgqueue.core.JobCancelledException;
import io.borgqueue.core.JobStatus;

import java.util.Objects;

/**
 * Execution context handed to a {@link JobHandler}: progress reporting and the cooperative
 * cancellation flag. Cancellation never preempts a handler; long-running handlers poll
 * {@link #isCancellationRequested()} or call {@link #throwIfCancelled()} between steps.
 */
public class JobContext {

    private final Job job;
    private final JobQueue queue;

    public JobContext(Job job, JobQueue queue) {
        this.job = Objects.requireNonNull(job, "job must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
    }

    public Job job() {
        return job;
    }

    public long jobId() {
        return job.id();
    }

    public void progress(int percent, String message) {
        queue.updateProgress(job.id(), percent, message);
    }

    /**
     * Reads the stored status. A job that vanished from the store counts as cancelled.
     */
    public boolean isCancellationRequested() {
        return queue.findById(job.id())
                .map(j -> j.status() == JobStatus.CANCELLED)
                .orElse(true);
    }

    public void throwIfCancelled() {
        if (isCancellationRequested()) {
            throw new JobCancelledException(job.id());
        }
    }

    /**
     * Records another attempt on this record before the handler retries internally.
     *
     * @return true if the handler may try again
     */
    public boolean recordRetryAttempt() {
        return queue.recordAttempt(job.id());
    }
}
