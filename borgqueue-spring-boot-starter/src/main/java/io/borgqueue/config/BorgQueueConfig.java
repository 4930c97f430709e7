package io.borgqueue.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.borgqueue.JobHandler;
import io.borgqueue.JobQueue;
import io.borgqueue.core.CompositeJobEventPublisher;
import io.borgqueue.core.JobHandlerRegistry;
import io.borgqueue.internal.mongo.MongoJobQueue;
import io.borgqueue.internal.mongo.MongoJobStore;
import io.borgqueue.internal.mongo.MongoScheduleStore;
import io.borgqueue.internal.mongo.MongoSequenceGenerator;
import io.borgqueue.internal.mongo.ServerStatsTaskSource;
import io.borgqueue.scheduler.BackupScheduler;
import io.borgqueue.scheduler.MaintenanceTaskSource;
import io.borgqueue.scheduler.ScheduleOutcomeRecorder;
import io.borgqueue.worker.Worker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the job queue, worker and backup scheduler.
 *
 * <p>The queue and stores are always available. The worker and the scheduler are opt-in per
 * process through {@code borgqueue.worker.enabled} and {@code borgqueue.scheduler.enabled}.
 */
@AutoConfiguration
@ConditionalOnClass({JobQueue.class, MongoTemplate.class})
@EnableConfigurationProperties(BorgQueueProperties.class)
@ConditionalOnProperty(prefix = "borgqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BorgQueueConfig {

    private static final Clock CLOCK = Clock.systemUTC();

    @Bean
    @ConditionalOnMissingBean
    protected MongoSequenceGenerator mongoSequenceGenerator(MongoTemplate mongoTemplate) {
        return new MongoSequenceGenerator(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, MongoSequenceGenerator sequenceGenerator) {
        return new MongoJobStore(mongoTemplate, objectMapper, sequenceGenerator);
    }

    @Bean
    @ConditionalOnMissingBean
    protected BorgQueueMongoIndexConfig borgQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new BorgQueueMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate) {
        return new MongoScheduleStore(mongoTemplate, CLOCK);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleOutcomeRecorder scheduleOutcomeRecorder(MongoScheduleStore scheduleStore) {
        return new ScheduleOutcomeRecorder(scheduleStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public SpringJobEventPublisher springJobEventPublisher(BorgQueueProperties props, ApplicationEventPublisher applicationEventPublisher) {
        return new SpringJobEventPublisher(applicationEventPublisher, props.getPush().getQueueCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public CompositeJobEventPublisher compositeJobEventPublisher(SpringJobEventPublisher springPublisher,
                                                                 ScheduleOutcomeRecorder outcomeRecorder) {
        return new CompositeJobEventPublisher(List.of(outcomeRecorder, springPublisher));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobQueue jobQueue(MongoJobStore jobStore, CompositeJobEventPublisher publisher) {
        return new MongoJobQueue(jobStore, publisher, CLOCK);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public ServerStatsTaskSource serverStatsTaskSource(MongoTemplate mongoTemplate) {
        return new ServerStatsTaskSource(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "borgqueue.worker", name = "enabled", havingValue = "true")
    public Worker borgQueueWorker(BorgQueueProperties props, JobQueue jobQueue, JobHandlerRegistry registry, ObjectMapper om) {
        return new Worker(jobQueue, registry, om, props.getWorker().toSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "borgqueue.worker", name = "enabled", havingValue = "true")
    public WorkerLifecycle workerLifecycle(Worker worker) {
        return new WorkerLifecycle(worker);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "borgqueue.scheduler", name = "enabled", havingValue = "true")
    public BackupScheduler backupScheduler(BorgQueueProperties props,
                                           JobQueue jobQueue,
                                           MongoScheduleStore scheduleStore,
                                           ObjectProvider<List<MaintenanceTaskSource>> sourcesProvider) {
        List<MaintenanceTaskSource> sources = sourcesProvider.getIfAvailable(List::of);
        return new BackupScheduler(jobQueue, scheduleStore, sources, props.getScheduler().toSettings(), CLOCK);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "borgqueue.scheduler", name = "enabled", havingValue = "true")
    public SchedulerLifecycle schedulerLifecycle(BackupScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "borgqueue", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton borgQueueIndexesInitializer(BorgQueueMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
