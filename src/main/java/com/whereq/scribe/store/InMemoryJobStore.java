package com.whereq.scribe.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.whereq.scribe.exception.JobNotFoundException;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobUpdate;
import com.whereq.scribe.model.TranscriptionJob;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.notify.StatusNotifier;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Job store held in a Caffeine cache, for single-process deployments.
 *
 * Like the Redis record TTL, the expiry clock starts when the job is created and
 * is not reset by updates. The size bound counts finished jobs only: QUEUED and
 * PROCESSING records weigh nothing and are never evicted for space.
 */
@Slf4j
public class InMemoryJobStore implements JobStore {

    private final Cache<String, TranscriptionJob> cache;
    private final StatusNotifier notifier;
    private final Clock clock;

    public InMemoryJobStore(StatusNotifier notifier, Clock clock, Duration ttl, long maxSize) {
        this.notifier = notifier;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
            .maximumWeight(maxSize)
            .weigher((String id, TranscriptionJob job) -> job.isTerminal() ? 1 : 0)
            .expireAfter(new Expiry<String, TranscriptionJob>() {
                @Override
                public long expireAfterCreate(String key, TranscriptionJob job, long currentTime) {
                    return ttl.toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, TranscriptionJob job, long currentTime, long currentDuration) {
                    return currentDuration;
                }

                @Override
                public long expireAfterRead(String key, TranscriptionJob job, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    @Override
    public Mono<String> create(String audioRef, TranscriptionParams params) {
        return Mono.fromCallable(() -> {
            String jobId = UUID.randomUUID().toString();
            TranscriptionJob job = TranscriptionJob.builder()
                .id(jobId)
                .status(JobStatus.QUEUED)
                .audioRef(audioRef)
                .params(params)
                .progress(0)
                .createdAt(clock.instant())
                .build();
            cache.put(jobId, job);
            log.info("Created job {}", jobId);
            return jobId;
        });
    }

    @Override
    public Mono<TranscriptionJob> get(String jobId) {
        return Mono.fromSupplier(() -> {
            TranscriptionJob job = cache.getIfPresent(jobId);
            return job != null ? job.toBuilder().build() : null;
        });
    }

    @Override
    public Mono<TranscriptionJob> update(String jobId, JobUpdate update) {
        return Mono.fromCallable(() -> {
                TranscriptionJob merged = cache.asMap().computeIfPresent(jobId,
                    (id, current) -> JobRecords.merge(current, update, clock.instant()));
                if (merged == null) {
                    throw new JobNotFoundException(jobId);
                }
                log.info("Updated job {} status to {}", jobId, merged.getStatus());
                return merged.toBuilder().build();
            })
            .flatMap(merged -> notifier.publish(jobId, merged.getStatus(), merged.getProgress())
                .thenReturn(merged));
    }

    @Override
    public Flux<TranscriptionJob> list(JobStatus status, int limit) {
        return Flux.defer(() -> {
            List<TranscriptionJob> jobs = cache.asMap().values().stream()
                .filter(job -> status == null || job.getStatus() == status)
                .sorted(JobRecords.NEWEST_FIRST)
                .limit(limit)
                .map(job -> job.toBuilder().build())
                .collect(Collectors.toList());
            return Flux.fromIterable(jobs);
        });
    }

    @Override
    public Mono<Long> sweepExpired(int olderThanDays) {
        return Mono.fromSupplier(() -> {
            Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
            long deleted = 0;
            for (Map.Entry<String, TranscriptionJob> entry : cache.asMap().entrySet()) {
                if (JobRecords.isExpired(entry.getValue(), cutoff)
                        && cache.asMap().remove(entry.getKey(), entry.getValue())) {
                    deleted++;
                }
            }
            log.info("Cleaned up {} old jobs", deleted);
            return deleted;
        });
    }

    @Override
    public Mono<Boolean> ping() {
        return Mono.just(true);
    }
}
