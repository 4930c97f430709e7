package io.borgqueue.internal.mongo;

import io.borgqueue.scheduler.JobTypes;
import io.borgqueue.scheduler.MaintenanceTask;
import io.borgqueue.scheduler.MaintenanceTaskSource;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One {@code server_stats_collect} task per distinct server that has an enabled backup target.
 */
public class ServerStatsTaskSource implements MaintenanceTaskSource {

    public static final String KEY_PREFIX = "server-stats:";

    private final MongoTemplate mongoTemplate;

    public ServerStatsTaskSource(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<MaintenanceTask> tasks() {
        List<Long> serverIds = mongoTemplate.findDistinct(
                new Query(Criteria.where("enabled").is(true)),
                "serverId",
                BackupTargetDocument.class,
                Long.class
        );
        return serverIds.stream()
                .filter(Objects::nonNull)
                .sorted()
                .map(id -> new MaintenanceTask(
                        JobTypes.SERVER_STATS_COLLECT,
                        KEY_PREFIX + id,
                        Map.of("server_id", id)))
                .toList();
    }
}
