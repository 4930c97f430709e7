package io.borgqueue.core;

/**
 * Immutable enqueue request produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobSpec<T>(

        // routing
        String queue,
        String type,

        // retry bookkeeping
        int maxAttempts,

        // provenance
        Long createdBy,
        String uniqueKey,

        // payload
        T payload
) {
}
