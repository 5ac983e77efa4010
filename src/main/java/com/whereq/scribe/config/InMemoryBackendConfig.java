package com.whereq.scribe.config;

import com.whereq.scribe.notify.InMemoryStatusNotifier;
import com.whereq.scribe.notify.StatusNotifier;
import com.whereq.scribe.queue.InMemoryJobQueue;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.store.InMemoryJobStore;
import com.whereq.scribe.store.JobStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * In-process backend, selected with {@code scribe.backend=memory}
 */
@Configuration
@ConditionalOnProperty(name = "scribe.backend", havingValue = "memory")
public class InMemoryBackendConfig {

    @Bean
    public StatusNotifier statusNotifier() {
        return new InMemoryStatusNotifier();
    }

    @Bean
    public JobStore jobStore(StatusNotifier statusNotifier, Clock clock, ScribeProperties properties) {
        return new InMemoryJobStore(statusNotifier, clock,
            properties.getStore().getTtl(), properties.getStore().getMaxInMemoryJobs());
    }

    @Bean
    public JobQueue jobQueue() {
        return new InMemoryJobQueue();
    }
}
