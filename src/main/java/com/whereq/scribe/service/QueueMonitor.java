package com.whereq.scribe.service;

import com.whereq.scribe.queue.JobQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples the queue length for the {@code scribe.queue.size} gauge
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueMonitor {

    private final JobQueue jobQueue;
    private final MeterRegistry meterRegistry;

    private final AtomicLong pending = new AtomicLong();

    @PostConstruct
    public void initialize() {
        Gauge.builder("scribe.queue.size", pending, AtomicLong::get)
            .description("Number of job ids waiting in the queue")
            .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${scribe.queue.monitor-interval:PT10S}")
    public void sample() {
        try {
            Long size = jobQueue.size().block();
            pending.set(size != null ? size : 0);
            log.debug("Queue size: {}", pending.get());
        } catch (RuntimeException e) {
            log.warn("Failed to sample queue size: {}", e.getMessage());
        }
    }

    public long lastSampledSize() {
        return pending.get();
    }
}
