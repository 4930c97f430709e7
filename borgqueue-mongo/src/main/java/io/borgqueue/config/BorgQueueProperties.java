package io.borgqueue.config;

import io.borgqueue.core.Lanes;
import io.borgqueue.scheduler.SchedulerSettings;
import io.borgqueue.worker.WorkerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration of the job queue, worker and backup scheduler.
 *
 * <p>One process usually runs either a worker ({@code borgqueue.worker.enabled=true}) or the
 * scheduler ({@code borgqueue.scheduler.enabled=true}); both only share the MongoDB database.
 */
@ConfigurationProperties(prefix = "borgqueue")
public class BorgQueueProperties {
    private boolean enabled = true;
    private boolean ensureIndexesOnStartup = false;
    private final Worker worker = new Worker();
    private final Scheduler scheduler = new Scheduler();
    private final Push push = new Push();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Worker getWorker() {
        return worker;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Push getPush() {
        return push;
    }

    /**
     * Delivery of job events to application listeners. Events are handed to one background
     * thread through a bounded buffer; when the buffer is full further events are dropped.
     */
    public static class Push {
        private int queueCapacity = 1000;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Worker {
        private boolean enabled = false;
        private String lane = Lanes.DEFAULT;
        private String workerId;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration shutdownGrace = Duration.ofSeconds(30);

        public WorkerSettings toSettings() {
            return new WorkerSettings(lane, workerId, pollInterval, shutdownGrace);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLane() {
            return lane;
        }

        public void setLane(String lane) {
            this.lane = lane;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private Duration tickInterval = Duration.ofSeconds(60);
        private Duration maintenanceInterval = Duration.ofMinutes(15);
        private String backupLane = Lanes.DEFAULT;
        private int backupMaxAttempts = 3;
        private int maintenanceMaxAttempts = 2;
        private Duration jobRetention = Duration.ofDays(30);

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(tickInterval, maintenanceInterval, backupLane,
                    backupMaxAttempts, maintenanceMaxAttempts, jobRetention);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getMaintenanceInterval() {
            return maintenanceInterval;
        }

        public void setMaintenanceInterval(Duration maintenanceInterval) {
            this.maintenanceInterval = maintenanceInterval;
        }

        public String getBackupLane() {
            return backupLane;
        }

        public void setBackupLane(String backupLane) {
            this.backupLane = backupLane;
        }

        public int getBackupMaxAttempts() {
            return backupMaxAttempts;
        }

        public void setBackupMaxAttempts(int backupMaxAttempts) {
            this.backupMaxAttempts = backupMaxAttempts;
        }

        public int getMaintenanceMaxAttempts() {
            return maintenanceMaxAttempts;
        }

        public void setMaintenanceMaxAttempts(int maintenanceMaxAttempts) {
            this.maintenanceMaxAttempts = maintenanceMaxAttempts;
        }

        public Duration getJobRetention() {
            return jobRetention;
        }

        public void setJobRetention(Duration jobRetention) {
            this.jobRetention = jobRetention;
        }
    }
}
