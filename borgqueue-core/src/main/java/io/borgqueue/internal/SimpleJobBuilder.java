package io.borgqueue.internal;

import io.borgqueue.JobBuilder;
import io.borgqueue.core.JobSpec;
import io.borgqueue.core.Lanes;

import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation. Persistence is delegated to the supplied function.
 */
public class SimpleJobBuilder<T> implements JobBuilder<T> {

    private final String type;
    private final T payload;
    private final Function<JobSpec<T>, Long> persister;

    private String queue = Lanes.DEFAULT;
    private int maxAttempts = Lanes.DEFAULT_MAX_ATTEMPTS;
    private Long createdBy;
    private String uniqueKey;

    public SimpleJobBuilder(String type, T payload, Function<JobSpec<T>, Long> persister) {
        Objects.requireNonNull(type, "job type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("job type must not be blank");
        }
        this.type = type;
        this.payload = payload;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder<T> queue(String queue) {
        Objects.requireNonNull(queue, "queue must not be null");
        if (queue.isBlank()) throw new IllegalArgumentException("queue must not be blank");

        this.queue = queue;
        return this;
    }

    @Override
    public JobBuilder<T> maxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    @Override
    public JobBuilder<T> createdBy(Long userId) {
        this.createdBy = userId;
        return this;
    }

    @Override
    public JobBuilder<T> uniqueKey(String uniqueKey) {
        Objects.requireNonNull(uniqueKey, "uniqueKey must not be null");
        if (uniqueKey.isBlank()) throw new IllegalArgumentException("uniqueKey must not be blank");

        this.uniqueKey = uniqueKey;
        return this;
    }

    @Override
    public JobSpec<T> build() {
        return new JobSpec<>(
                queue,
                type,
                maxAttempts,
                createdBy,
                uniqueKey,
                payload
        );
    }

    @Override
    public long enqueue() {
        return persister.apply(build());
    }
}
