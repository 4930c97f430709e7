package io.borgqueue.core;

/**
 * Raised by a handler that observed a cancellation request and stopped early.
 */
public class JobCancelledException extends RuntimeException {

    private final long jobId;

    public JobCancelledException(long jobId) {
        super("Job #" + jobId + " was cancelled");
        this.jobId = jobId;
    }

    public long jobId() {
        return jobId;
    }
}
