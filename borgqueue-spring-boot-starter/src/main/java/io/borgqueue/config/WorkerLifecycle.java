package io.borgqueue.config;

import io.borgqueue.worker.Worker;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges Worker start/stop lifecycle with the Spring container lifecycle.
 */
public class WorkerLifecycle implements SmartLifecycle {
    private final Worker worker;
    private volatile boolean running = false;

    public WorkerLifecycle(Worker worker) {
        this.worker = worker;
    }

    @Override
    public void start() {
        worker.start();
        running = true;
    }

    @Override
    public void stop() {
        worker.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
