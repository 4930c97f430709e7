package io.borgqueue.scheduler;

/**
 * Job types the scheduler produces.
 */
public final class JobTypes {

    public static final String BACKUP_CREATE = "backup_create";
    public static final String SERVER_STATS_COLLECT = "server_stats_collect";

    private JobTypes() {
    }
}
