package com.whereq.scribe.store;

import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobUpdate;
import com.whereq.scribe.model.TranscriptionJob;
import com.whereq.scribe.model.TranscriptionParams;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keyed store of transcription job records.
 *
 * Records expire on their own after a configured lifetime. Every successful
 * {@link #update} broadcasts the new status through the status notifier.
 */
public interface JobStore {

    /**
     * Create a QUEUED record with progress 0.
     *
     * @param audioRef handle of the stored audio
     * @param params engine parameters
     * @return Mono with the new job id
     */
    Mono<String> create(String audioRef, TranscriptionParams params);

    /**
     * @param jobId job identifier
     * @return Mono with the full record, empty if the store holds no such job
     */
    Mono<TranscriptionJob> get(String jobId);

    /**
     * Merge the non-null fields of {@code update} into the record.
     *
     * Errors with {@link com.whereq.scribe.exception.JobNotFoundException} for an unknown id
     * and with {@link com.whereq.scribe.exception.InvalidJobTransitionException} when the
     * update breaks the lifecycle. Nothing is written in either case.
     *
     * @param jobId job identifier
     * @param update fields to change
     * @return Mono with the record after the merge
     */
    Mono<TranscriptionJob> update(String jobId, JobUpdate update);

    /**
     * Scan the store. Newest first, O(n) over all records; not meant for hot paths.
     *
     * @param status only jobs in this status, or all when null
     * @param limit maximum number of jobs returned
     * @return Flux of jobs ordered by createdAt descending
     */
    Flux<TranscriptionJob> list(JobStatus status, int limit);

    /**
     * Delete terminal jobs completed more than {@code olderThanDays} ago.
     * QUEUED and PROCESSING jobs are never deleted.
     *
     * @param olderThanDays age threshold in days
     * @return Mono with the number of deleted jobs
     */
    Mono<Long> sweepExpired(int olderThanDays);

    /**
     * @return Mono with true if the backend answers
     */
    Mono<Boolean> ping();
}
