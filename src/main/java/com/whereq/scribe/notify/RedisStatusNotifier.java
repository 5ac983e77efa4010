package com.whereq.scribe.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobStatusEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Status notifier on Redis pub/sub. Channel per job: {@code scribe:job:{id}:status}.
 */
@Slf4j
public class RedisStatusNotifier implements StatusNotifier {

    private static final String CHANNEL_PREFIX = "scribe:job:";
    private static final String CHANNEL_SUFFIX = ":status";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisStatusNotifier(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> publish(String jobId, JobStatus status, Integer progress) {
        JobStatusEvent event = JobStatusEvent.of(jobId, status, progress);

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
            .flatMap(json -> redisTemplate.convertAndSend(channel(jobId), json))
            .doOnSuccess(receivers -> log.debug("Published {} for job {} to {} subscribers",
                status, jobId, receivers))
            .doOnError(error -> log.warn("Failed to publish status {} for job {}: {}",
                status, jobId, error.getMessage()))
            .onErrorResume(e -> Mono.empty())
            .then();
    }

    @Override
    public Flux<JobStatusEvent> subscribe(String jobId) {
        return redisTemplate.listenToChannel(channel(jobId))
            .flatMap(this::read);
    }

    @Override
    public Mono<Flux<JobStatusEvent>> subscribeWhenReady(String jobId) {
        // completes after Redis confirmed the SUBSCRIBE
        return redisTemplate.listenToChannelLater(channel(jobId))
            .map(messages -> messages.flatMap(this::read));
    }

    private Mono<JobStatusEvent> read(ReactiveSubscription.Message<String, String> message) {
        try {
            return Mono.just(objectMapper.readValue(message.getMessage(), JobStatusEvent.class));
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable status event on {}", message.getChannel(), e);
            return Mono.empty();
        }
    }

    static String channel(String jobId) {
        return CHANNEL_PREFIX + jobId + CHANNEL_SUFFIX;
    }
}
