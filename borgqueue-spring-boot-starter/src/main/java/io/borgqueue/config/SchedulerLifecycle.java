package io.borgqueue.config;

import io.borgqueue.scheduler.BackupScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges BackupScheduler start/stop lifecycle with the Spring container lifecycle.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final BackupScheduler scheduler;
    private volatile boolean running = false;

    public SchedulerLifecycle(BackupScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // stops before the worker in a combined process
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
