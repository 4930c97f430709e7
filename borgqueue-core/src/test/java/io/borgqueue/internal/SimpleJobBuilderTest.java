package io.borgqueue.internal;

import io.borgqueue.core.JobSpec;
import io.borgqueue.core.Lanes;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SimpleJobBuilderTest {

    @Test
    void defaultsShouldTargetDefaultLane() {
        JobSpec<Map<String, Object>> spec = new SimpleJobBuilder<>("backup_create", Map.<String, Object>of("server_id", 1), s -> 1L).build();

        assertEquals(Lanes.DEFAULT, spec.queue());
        assertEquals(Lanes.DEFAULT_MAX_ATTEMPTS, spec.maxAttempts());
        assertNull(spec.uniqueKey());
        assertNull(spec.createdBy());
    }

    @Test
    void enqueueShouldHandBuiltSpecToPersister() {
        AtomicReference<JobSpec<String>> persisted = new AtomicReference<>();

        long id = new SimpleJobBuilder<>("repository_check", "repo-7", spec -> {
            persisted.set(spec);
            return 42L;
        })
                .queue(Lanes.PRIVILEGED)
                .maxAttempts(1)
                .createdBy(5L)
                .uniqueKey("repo-check:7")
                .enqueue();

        assertEquals(42L, id);
        assertEquals(Lanes.PRIVILEGED, persisted.get().queue());
        assertEquals(1, persisted.get().maxAttempts());
        assertEquals(5L, persisted.get().createdBy());
        assertEquals("repo-check:7", persisted.get().uniqueKey());
        assertEquals("repo-7", persisted.get().payload());
    }

    @Test
    void invalidInputShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SimpleJobBuilder<>(" ", null, s -> 1L));
        SimpleJobBuilder<String> builder = new SimpleJobBuilder<>("backup_create", null, s -> 1L);
        assertThrows(IllegalArgumentException.class, () -> builder.maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> builder.queue(""));
    }
}
