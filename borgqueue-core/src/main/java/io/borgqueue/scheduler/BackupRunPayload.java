package io.borgqueue.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@code backup_create} job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackupRunPayload(
        @JsonProperty("server_id") long serverId,
        @JsonProperty("server_name") String serverName,
        @JsonProperty("backup_job_id") long backupJobId,
        @JsonProperty("repository_id") long repositoryId,
        @JsonProperty("repository_name") String repositoryName,
        @JsonProperty("scheduled") boolean scheduled,
        @JsonProperty("triggered_by") String triggeredBy
) {

    public static BackupRunPayload scheduled(ScheduledTarget target) {
        String serverName = target.serverName() != null
                ? target.serverName()
                : "Server #" + target.serverId();
        return new BackupRunPayload(
                target.serverId(),
                serverName,
                target.targetId(),
                target.repositoryId(),
                target.name(),
                true,
                "scheduled"
        );
    }
}
