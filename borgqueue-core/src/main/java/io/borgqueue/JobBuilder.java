package io.borgqueue;

import io.borgqueue.core.JobSpec;

/**
 * Fluent builder for configuring a job before enqueueing it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>enqueue(): build() + insert as a pending job</li>
 * </ul>
 */
public interface JobBuilder<T> {

    /**
     * Lane the job is routed to. Defaults to {@code default}.
     */
    JobBuilder<T> queue(String queue);

    /**
     * Retry ceiling used by handlers and resubmission. Defaults to 3.
     */
    JobBuilder<T> maxAttempts(int maxAttempts);

    /**
     * Operator that requested the job; null for system jobs.
     */
    JobBuilder<T> createdBy(Long userId);

    /**
     * Idempotency key, used by producers to check for an active job before enqueueing.
     */
    JobBuilder<T> uniqueKey(String uniqueKey);

    JobSpec<T> build();

    /**
     * Build + insert.
     *
     * @return the id of the new job
     */
    long enqueue();
}
