package io.borgqueue.internal.mongo;

import io.borgqueue.scheduler.RunStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for backup targets (what to back up, where to) and their run bookkeeping.
 */
@Document(collection = "backup_jobs")
public class BackupTargetDocument {

    @Id
    private Long id;

    private String name;
    private long repositoryId;
    private long serverId;
    private String serverName;
    private boolean enabled;

    private Instant lastRunAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private RunStatus lastStatus;
    private int consecutiveFailures;
    private long totalRuns;

    public BackupTargetDocument() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getRepositoryId() {
        return repositoryId;
    }

    public void setRepositoryId(long repositoryId) {
        this.repositoryId = repositoryId;
    }

    public long getServerId() {
        return serverId;
    }

    public void setServerId(long serverId) {
        this.serverId = serverId;
    }

    public String getServerName() {
        return serverName;
    }

    public void setServerName(String serverName) {
        this.serverName = serverName;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public RunStatus getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(RunStatus lastStatus) {
        this.lastStatus = lastStatus;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public long getTotalRuns() {
        return totalRuns;
    }

    public void setTotalRuns(long totalRuns) {
        this.totalRuns = totalRuns;
    }
}
