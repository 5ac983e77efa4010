package com.whereq.scribe.queue;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * FIFO queue of pending job ids. The queue carries ids only; the job itself lives in the store.
 *
 * Every backend must hand each enqueued id to exactly one dequeue caller, even with
 * many concurrent consumers. Job ownership depends on it.
 */
public interface JobQueue {
    /**
     * Append a job id to the tail of the queue. Never waits for a consumer.
     * Duplicate ids are not detected.
     *
     * @param jobId the job identifier
     * @return Mono that completes when the id is enqueued
     */
    Mono<Void> enqueue(String jobId);

    /**
     * Take the id at the head of the queue, waiting up to {@code timeout} for one to arrive
     *
     * @param timeout maximum wait
     * @return Mono with the id, empty if the timeout elapsed
     */
    Mono<String> dequeue(Duration timeout);

    /**
     * Get current queue size
     *
     * @return Mono with the number of pending ids
     */
    Mono<Long> size();

    /**
     * Check whether an id is still pending
     *
     * @param jobId the job identifier
     * @return Mono with true if the id is in the queue
     */
    Mono<Boolean> contains(String jobId);

    /**
     * Check if queue is full
     *
     * @param maxSize maximum allowed size
     * @return Mono with true if queue is full
     */
    default Mono<Boolean> isFull(long maxSize) {
        return size().map(s -> s >= maxSize);
    }
}
