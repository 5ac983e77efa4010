package com.whereq.scribe.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis list backed job queue. RPUSH at the tail, BLPOP from the head.
 * BLPOP hands an element to a single client, which gives single delivery across
 * workers in any number of processes.
 */
@Slf4j
public class RedisJobQueue implements JobQueue {

    static final String QUEUE_KEY = "scribe:jobs:queue";

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    public RedisJobQueue(ReactiveRedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<Void> enqueue(String jobId) {
        return redisTemplate.opsForList().rightPush(QUEUE_KEY, jobId)
            .doOnSuccess(size -> log.info("Enqueued job {}, queue size: {}", jobId, size))
            .then();
    }

    @Override
    public Mono<String> dequeue(Duration timeout) {
        return redisTemplate.opsForList().leftPop(QUEUE_KEY, timeout)
            .doOnNext(jobId -> log.debug("Dequeued job {}", jobId));
    }

    @Override
    public Mono<Long> size() {
        return redisTemplate.opsForList().size(QUEUE_KEY)
            .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Boolean> contains(String jobId) {
        return redisTemplate.opsForList().indexOf(QUEUE_KEY, jobId)
            .map(index -> index >= 0)
            .defaultIfEmpty(false);
    }
}
