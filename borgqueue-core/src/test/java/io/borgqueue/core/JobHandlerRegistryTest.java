package io.borgqueue.core;

import io.borgqueue.JobContext;
import io.borgqueue.JobHandler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobHandlerRegistryTest {

    @Test
    void shouldFindHandlersByType() {
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(new EchoHandler("backup_create"), new EchoHandler("backup_prune")));

        assertThat(registry.types()).isEqualTo(Set.of("backup_create", "backup_prune"));
        assertThat(registry.find("backup_create")).isPresent();
        assertThat(registry.find("server_stats_collect")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.isEmpty()).isFalse();
    }

    @Test
    void duplicateTypesShouldFailFast() {
        assertThatThrownBy(() -> new JobHandlerRegistry(List.of(new EchoHandler("backup_create"), new EchoHandler("backup_create"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("backup_create");
    }

    @Test
    void emptyRegistryShouldFindNothing() {
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of());

        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.find("backup_create")).isEmpty();
    }

    private record EchoHandler(String type) implements JobHandler<String> {
        @Override
        public Class<String> payloadClass() {
            return String.class;
        }

        @Override
        public String execute(String payload, JobContext context) {
            return payload;
        }
    }
}
