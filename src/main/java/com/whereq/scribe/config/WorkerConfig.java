package com.whereq.scribe.config;

import com.whereq.scribe.engine.TranscriptionEngine;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.storage.AudioStorage;
import com.whereq.scribe.storage.LocalAudioStorage;
import com.whereq.scribe.store.JobStore;
import com.whereq.scribe.worker.TranscriptionWorker;
import com.whereq.scribe.worker.WorkerPool;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Workers, audio storage and clock
 */
@Configuration
@EnableScheduling
public class WorkerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AudioStorage audioStorage(ScribeProperties properties) {
        return new LocalAudioStorage(Path.of(properties.getStorage().getDirectory()));
    }

    @Bean
    @ConditionalOnProperty(name = "scribe.worker.enabled", havingValue = "true", matchIfMissing = true)
    public WorkerPool workerPool(ScribeProperties properties,
                                 JobQueue jobQueue,
                                 JobStore jobStore,
                                 TranscriptionEngine transcriptionEngine,
                                 AudioStorage audioStorage,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        ScribeProperties.WorkerConfig worker = properties.getWorker();

        return new WorkerPool(worker.getCount(), worker.getShutdownTimeout(),
            (name, stopSignal) -> new TranscriptionWorker(name, jobQueue, jobStore, transcriptionEngine,
                audioStorage, stopSignal, clock, worker.getPollTimeout(), worker.getErrorBackoff(), meterRegistry));
    }
}
