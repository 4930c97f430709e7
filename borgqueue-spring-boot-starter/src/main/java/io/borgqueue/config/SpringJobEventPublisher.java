package io.borgqueue.config;

import io.borgqueue.core.JobEvent;
import io.borgqueue.core.JobEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Objects;

/**
 * Forwards job events to the Spring application event bus, where a push endpoint (for example
 * a server-sent-events controller) can pick them up with {@code @EventListener JobEvent}.
 *
 * <p>Listeners run on a single background thread, in publish order. The caller only enqueues
 * the event into a bounded buffer and never waits for a listener; when the buffer is full the
 * event is dropped with a warning.
 */
public class SpringJobEventPublisher implements JobEventPublisher, DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(SpringJobEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final ThreadPoolTaskExecutor executor;

    public SpringJobEventPublisher(ApplicationEventPublisher applicationEventPublisher, int queueCapacity) {
        this.applicationEventPublisher = Objects.requireNonNull(applicationEventPublisher, "applicationEventPublisher must not be null");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }

        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("borgqueue.events-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
    }

    @Override
    public void publish(JobEvent event) {
        try {
            executor.execute(() -> deliver(event));
        } catch (TaskRejectedException e) {
            log.warn("job event dropped, push buffer full jobId={} status={}", event.jobId(), event.status());
        }
    }

    private void deliver(JobEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("job event listener failed jobId={} status={} msg={}", event.jobId(), event.status(), e.getMessage());
        }
    }

    @Override
    public void destroy() {
        executor.shutdown();
    }
}
