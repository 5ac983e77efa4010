package com.whereq.scribe.service;

import com.whereq.scribe.config.ScribeProperties;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Puts QUEUED jobs that have no queue entry back on the queue.
 *
 * Such records are left behind when a submission dies between writing the record and
 * enqueueing its id. A job that was dequeued but not yet claimed can be enqueued a second
 * time; the store then rejects the second claim and the worker skips it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scribe.reconcile.enabled", havingValue = "true", matchIfMissing = true)
public class OrphanedJobReconciler {

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final Clock clock;
    private final ScribeProperties properties;

    @Scheduled(fixedDelayString = "${scribe.reconcile.interval:PT5M}",
               initialDelayString = "${scribe.reconcile.interval:PT5M}")
    public void run() {
        try {
            Long requeued = reconcile().block();
            if (requeued != null && requeued > 0) {
                log.warn("Reconciliation re-enqueued {} orphaned jobs", requeued);
            }
        } catch (RuntimeException e) {
            log.error("Reconciliation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return Mono with the number of re-enqueued jobs
     */
    public Mono<Long> reconcile() {
        ScribeProperties.ReconcileConfig config = properties.getReconcile();
        Instant cutoff = clock.instant().minus(config.getGracePeriod());

        return jobStore.list(JobStatus.QUEUED, config.getScanLimit())
            .filter(job -> job.getCreatedAt() != null && job.getCreatedAt().isBefore(cutoff))
            .filterWhen(job -> jobQueue.contains(job.getId()).map(pending -> !pending))
            .concatMap(job -> jobQueue.enqueue(job.getId())
                .doOnSuccess(v -> log.warn("Re-enqueued orphaned job {} created at {}",
                    job.getId(), job.getCreatedAt()))
                .thenReturn(job.getId()))
            .count();
    }
}
