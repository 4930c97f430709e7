package io.borgqueue.core;

import io.borgqueue.JobHandler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Handlers of one worker, keyed by job type. Built once at startup and never mutated.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler<?>> handlersByType;

    public JobHandlerRegistry(List<? extends JobHandler<?>> handlers) {
        this.handlersByType = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobHandler::type,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobHandler type: " + a.type());
                        }
                ));
    }

    public Optional<JobHandler<?>> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlersByType.get(type));
    }

    public Set<String> types() {
        return handlersByType.keySet();
    }

    public boolean isEmpty() {
        return handlersByType.isEmpty();
    }
}
