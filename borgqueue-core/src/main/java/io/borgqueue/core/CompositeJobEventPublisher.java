package io.borgqueue.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fans an event out to several publishers. One failing publisher does not prevent the others
 * from receiving the event.
 */
public class CompositeJobEventPublisher implements JobEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(CompositeJobEventPublisher.class);

    private final List<JobEventPublisher> delegates;

    public CompositeJobEventPublisher(List<? extends JobEventPublisher> delegates) {
        Objects.requireNonNull(delegates, "delegates must not be null");
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void publish(JobEvent event) {
        for (JobEventPublisher delegate : delegates) {
            try {
                delegate.publish(event);
            } catch (Exception e) {
                log.warn("job event delivery failed publisher={} jobId={} status={} msg={}",
                        delegate.getClass().getSimpleName(), event.jobId(), event.status(), e.getMessage());
            }
        }
    }

    public int size() {
        return delegates.size();
    }
}
