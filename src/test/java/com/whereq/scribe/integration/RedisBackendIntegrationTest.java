package com.whereq.scribe.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.whereq.scribe.exception.InvalidJobTransitionException;
import com.whereq.scribe.exception.JobNotFoundException;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobStatusEvent;
import com.whereq.scribe.model.JobUpdate;
import com.whereq.scribe.model.TaskKind;
import com.whereq.scribe.model.TranscriptSegment;
import com.whereq.scribe.model.TranscriptionJob;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.model.TranscriptionResult;
import com.whereq.scribe.notify.RedisStatusNotifier;
import com.whereq.scribe.queue.RedisJobQueue;
import com.whereq.scribe.store.MutableClock;
import com.whereq.scribe.store.RedisJobStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Redis-backed store, queue and notifier against a real Redis.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisBackendIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>("redis:7-alpine").withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static ReactiveRedisTemplate<String, String> template;

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private MutableClock clock;
    private RedisStatusNotifier notifier;
    private RedisJobStore store;
    private RedisJobQueue queue;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(redis.getHost(), redis.getMappedPort(6379));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();

        StringRedisSerializer serializer = new StringRedisSerializer();
        template = new ReactiveRedisTemplate<>(connectionFactory,
            RedisSerializationContext.<String, String>newSerializationContext(serializer)
                .hashKey(serializer)
                .hashValue(serializer)
                .build());
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        template.execute(connection -> connection.serverCommands().flushAll()).blockLast();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        notifier = new RedisStatusNotifier(template, objectMapper);
        store = new RedisJobStore(template, objectMapper, notifier, clock, Duration.ofDays(7));
        queue = new RedisJobQueue(template);
    }

    @Test
    void jobLifecycleSurvivesRoundTrip() {
        TranscriptionParams params = TranscriptionParams.builder()
            .language("de")
            .task(TaskKind.TRANSLATE)
            .enableDiarization(true)
            .minSpeakers(2)
            .originalFilename("call.wav")
            .build();
        String jobId = store.create("a.wav", params).block();

        TranscriptionJob queued = store.get(jobId).block();
        assertThat(queued.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(queued.getProgress()).isZero();
        assertThat(queued.getParams()).isEqualTo(params);
        assertThat(queued.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(template.getExpire("scribe:job:" + jobId).block()).isPositive();

        store.update(jobId, JobUpdate.claimed(clock.instant())).block();
        clock.advance(Duration.ofSeconds(30));
        TranscriptionResult result = TranscriptionResult.builder()
            .text("hallo")
            .language("de")
            .duration(2.0)
            .segments(List.of(TranscriptSegment.builder().start(0).end(2).text("hallo").speaker("SPEAKER_00").build()))
            .build();
        store.update(jobId, JobUpdate.completed(result, clock.instant())).block();

        TranscriptionJob completed = store.get(jobId).block();
        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.getProgress()).isEqualTo(100);
        assertThat(completed.getStartedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(completed.getCompletedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:30Z"));
        assertThat(completed.getResult().getText()).isEqualTo("hallo");
        assertThat(completed.getResult().getSegments()).extracting(TranscriptSegment::getSpeaker)
            .containsExactly("SPEAKER_00");
        assertThat(completed.getError()).isNull();
    }

    @Test
    void updateRules() {
        String jobId = store.create("a.wav", TranscriptionParams.defaults()).block();

        StepVerifier.create(store.update("missing", JobUpdate.claimed(clock.instant())))
            .expectError(JobNotFoundException.class)
            .verify();
        StepVerifier.create(store.update(jobId, JobUpdate.failed("boom", clock.instant())))
            .expectError(InvalidJobTransitionException.class)
            .verify();

        assertThat(store.get(jobId).block().getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void listAndSweep() {
        String old = store.create("a.wav", TranscriptionParams.defaults()).block();
        store.update(old, JobUpdate.claimed(clock.instant())).block();
        store.update(old, JobUpdate.failed("boom", clock.instant())).block();
        clock.advance(Duration.ofDays(4));
        String fresh = store.create("b.wav", TranscriptionParams.defaults()).block();

        assertThat(store.list(null, 10).map(TranscriptionJob::getId).collectList().block())
            .containsExactly(fresh, old);
        assertThat(store.list(JobStatus.FAILED, 10).map(TranscriptionJob::getId).collectList().block())
            .containsExactly(old);

        StepVerifier.create(store.sweepExpired(3)).expectNext(1L).verifyComplete();
        assertThat(store.get(old).block()).isNull();
        assertThat(store.get(fresh).block()).isNotNull();
    }

    @Test
    void queueIsFifoWithBoundedWait() {
        queue.enqueue("j1").block();
        queue.enqueue("j2").block();

        assertThat(queue.size().block()).isEqualTo(2L);
        assertThat(queue.contains("j2").block()).isTrue();
        assertThat(queue.dequeue(Duration.ofSeconds(1)).block()).isEqualTo("j1");
        assertThat(queue.dequeue(Duration.ofSeconds(1)).block()).isEqualTo("j2");
        assertThat(queue.contains("j2").block()).isFalse();

        StepVerifier.create(queue.dequeue(Duration.ofSeconds(1)))
            .expectComplete()
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void notifierDeliversToSubscribers() {
        Disposable publisher = Flux.interval(Duration.ofMillis(100))
            .concatMap(i -> notifier.publish("job-1", JobStatus.PROCESSING, 10))
            .subscribe();
        try {
            JobStatusEvent event = notifier.subscribe("job-1").next().block(Duration.ofSeconds(10));

            assertThat(event.getJobId()).isEqualTo("job-1");
            assertThat(event.getStatus()).isEqualTo(JobStatus.PROCESSING);
            assertThat(event.getProgress()).isEqualTo(10);
        } finally {
            publisher.dispose();
        }
    }

    @Test
    void readySubscriptionGetsFirstPublish() throws Exception {
        Flux<JobStatusEvent> live = notifier.subscribeWhenReady("job-2").block(Duration.ofSeconds(10));
        CompletableFuture<JobStatusEvent> first = live.next().toFuture();

        notifier.publish("job-2", JobStatus.COMPLETED, 100).block();

        JobStatusEvent event = first.get(10, TimeUnit.SECONDS);
        assertThat(event.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(event.getProgress()).isEqualTo(100);
    }

    @Test
    void pingReportsConnection() {
        StepVerifier.create(store.ping()).expectNext(true).verifyComplete();
    }
}
