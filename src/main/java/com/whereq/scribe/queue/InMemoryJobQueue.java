package com.whereq.scribe.queue;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-process job queue. {@link BlockingQueue#poll(long, TimeUnit)} removes each
 * element for exactly one caller.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

    private final BlockingQueue<String> pending = new LinkedBlockingQueue<>();

    @Override
    public Mono<Void> enqueue(String jobId) {
        return Mono.fromRunnable(() -> {
            pending.add(jobId);
            log.info("Enqueued job {}, queue size: {}", jobId, pending.size());
        });
    }

    @Override
    public Mono<String> dequeue(Duration timeout) {
        return Mono.fromCallable(() -> pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS))
            .doOnNext(jobId -> log.debug("Dequeued job {}", jobId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Long> size() {
        return Mono.fromSupplier(() -> (long) pending.size());
    }

    @Override
    public Mono<Boolean> contains(String jobId) {
        return Mono.fromSupplier(() -> pending.contains(jobId));
    }
}
