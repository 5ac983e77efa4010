package com.whereq.scribe.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.scribe.exception.JobNotFoundException;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobUpdate;
import com.whereq.scribe.model.TranscriptionJob;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.model.TranscriptionResult;
import com.whereq.scribe.notify.StatusNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Job records as Redis hashes under {@code scribe:job:{id}}.
 *
 * The TTL is set once at creation; later field writes do not extend it.
 * Updates read the record, check the lifecycle, then write only the changed fields.
 * The read and the write are not atomic: exclusive ownership after dequeue is what
 * keeps concurrent writers away from a job.
 */
@Slf4j
public class RedisJobStore implements JobStore {

    static final String KEY_PREFIX = "scribe:job:";
    private static final String KEY_PATTERN = KEY_PREFIX + "*";
    private static final long SCAN_COUNT = 1000;

    static final String ID = "id";
    static final String STATUS = "status";
    static final String AUDIO_REF = "audioRef";
    static final String PARAMS = "params";
    static final String PROGRESS = "progress";
    static final String CREATED_AT = "createdAt";
    static final String STARTED_AT = "startedAt";
    static final String COMPLETED_AT = "completedAt";
    static final String RESULT = "result";
    static final String ERROR = "error";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final StatusNotifier notifier;
    private final Clock clock;
    private final Duration ttl;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         StatusNotifier notifier,
                         Clock clock,
                         Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.notifier = notifier;
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Mono<String> create(String audioRef, TranscriptionParams params) {
        String jobId = UUID.randomUUID().toString();
        String key = key(jobId);

        return Mono.fromCallable(() -> toFields(TranscriptionJob.builder()
                .id(jobId)
                .status(JobStatus.QUEUED)
                .audioRef(audioRef)
                .params(params)
                .progress(0)
                .createdAt(clock.instant())
                .build()))
            .flatMap(fields -> hashOps().putAll(key, fields))
            .then(redisTemplate.expire(key, ttl))
            .doOnSuccess(v -> log.info("Created job {}", jobId))
            .thenReturn(jobId);
    }

    @Override
    public Mono<TranscriptionJob> get(String jobId) {
        return hashOps().entries(key(jobId))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .filter(fields -> !fields.isEmpty())
            .flatMap(fields -> Mono.justOrEmpty(parse(jobId, fields)));
    }

    @Override
    public Mono<TranscriptionJob> update(String jobId, JobUpdate update) {
        return get(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
            .flatMap(current -> {
                TranscriptionJob merged = JobRecords.merge(current, update, clock.instant());
                Map<String, String> changed = changedFields(current, merged);
                if (changed.isEmpty()) {
                    return Mono.just(merged);
                }
                return hashOps().putAll(key(jobId), changed).thenReturn(merged);
            })
            .doOnSuccess(merged -> log.info("Updated job {} status to {}", jobId, merged.getStatus()))
            .flatMap(merged -> notifier.publish(jobId, merged.getStatus(), merged.getProgress())
                .thenReturn(merged));
    }

    @Override
    public Flux<TranscriptionJob> list(JobStatus status, int limit) {
        return scanJobs()
            .filter(job -> status == null || job.getStatus() == status)
            .sort(JobRecords.NEWEST_FIRST)
            .take(limit);
    }

    @Override
    public Mono<Long> sweepExpired(int olderThanDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));

        return scanJobs()
            .filter(job -> JobRecords.isExpired(job, cutoff))
            .flatMap(job -> redisTemplate.delete(key(job.getId())))
            .reduce(0L, Long::sum)
            .doOnSuccess(deleted -> log.info("Cleaned up {} old jobs", deleted));
    }

    @Override
    public Mono<Boolean> ping() {
        return redisTemplate.execute(connection -> connection.ping())
            .next()
            .map("PONG"::equalsIgnoreCase)
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.warn("Redis ping failed: {}", e.getMessage());
                return Mono.just(false);
            });
    }

    private Flux<TranscriptionJob> scanJobs() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(KEY_PATTERN).count(SCAN_COUNT).build())
            .map(key -> key.substring(KEY_PREFIX.length()))
            .concatMap(this::get);
    }

    private ReactiveHashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }

    static String key(String jobId) {
        return KEY_PREFIX + jobId;
    }

    private Map<String, String> changedFields(TranscriptionJob current, TranscriptionJob merged) {
        Map<String, String> before = toFields(current);
        Map<String, String> changed = new HashMap<>();
        toFields(merged).forEach((field, value) -> {
            if (!Objects.equals(before.get(field), value)) {
                changed.put(field, value);
            }
        });
        return changed;
    }

    Map<String, String> toFields(TranscriptionJob job) {
        Map<String, String> fields = new HashMap<>();
        fields.put(ID, job.getId());
        fields.put(STATUS, job.getStatus().name());
        fields.put(PROGRESS, String.valueOf(job.getProgress()));
        putIfPresent(fields, AUDIO_REF, job.getAudioRef());
        putIfPresent(fields, CREATED_AT, job.getCreatedAt());
        putIfPresent(fields, STARTED_AT, job.getStartedAt());
        putIfPresent(fields, COMPLETED_AT, job.getCompletedAt());
        putIfPresent(fields, ERROR, job.getError());
        try {
            if (job.getParams() != null) {
                fields.put(PARAMS, objectMapper.writeValueAsString(job.getParams()));
            }
            if (job.getResult() != null) {
                fields.put(RESULT, objectMapper.writeValueAsString(job.getResult()));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.getId(), e);
        }
        return fields;
    }

    /**
     * Null for hashes missing the identity fields, so a stray partial write never reads as a job
     */
    TranscriptionJob parse(String jobId, Map<String, String> fields) {
        if (!fields.containsKey(ID) || !fields.containsKey(STATUS)) {
            log.warn("Ignoring incomplete record for job {}: fields {}", jobId, fields.keySet());
            return null;
        }
        try {
            return TranscriptionJob.builder()
                .id(fields.get(ID))
                .status(JobStatus.valueOf(fields.get(STATUS)))
                .audioRef(fields.get(AUDIO_REF))
                .params(fields.containsKey(PARAMS)
                    ? objectMapper.readValue(fields.get(PARAMS), TranscriptionParams.class) : null)
                .progress(fields.containsKey(PROGRESS) ? Integer.parseInt(fields.get(PROGRESS)) : 0)
                .createdAt(parseInstant(fields.get(CREATED_AT)))
                .startedAt(parseInstant(fields.get(STARTED_AT)))
                .completedAt(parseInstant(fields.get(COMPLETED_AT)))
                .result(fields.containsKey(RESULT)
                    ? objectMapper.readValue(fields.get(RESULT), TranscriptionResult.class) : null)
                .error(fields.get(ERROR))
                .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt record for job " + jobId, e);
        }
    }

    private static void putIfPresent(Map<String, String> fields, String field, Object value) {
        if (value != null) {
            fields.put(field, value.toString());
        }
    }

    private static Instant parseInstant(String value) {
        return value != null ? Instant.parse(value) : null;
    }
}
