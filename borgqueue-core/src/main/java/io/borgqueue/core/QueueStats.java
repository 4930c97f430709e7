package io.borgqueue.core;

/**
 * Job counts per status.
 */
public record QueueStats(
        long pending,
        long running,
        long completed,
        long failed,
        long cancelled
) {

    public static QueueStats empty() {
        return new QueueStats(0, 0, 0, 0, 0);
    }

    public long total() {
        return pending + running + completed + failed + cancelled;
    }

    public long active() {
        return pending + running;
    }
}
