package com.whereq.scribe.notify;

import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobStatusEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Live broadcast of job status changes, one channel per job.
 *
 * Delivery is best effort and at most once per subscriber. Nothing is persisted and
 * nothing is replayed: a subscriber only sees events published after it subscribed,
 * and an event published while nobody listens is lost. Implementations must not add
 * buffering or history.
 */
public interface StatusNotifier {

    /**
     * Broadcast a status change to the current subscribers of a job.
     * Never signals an error; failures are logged and dropped.
     *
     * @param jobId job identifier
     * @param status new status
     * @param progress current progress
     * @return Mono that completes once the event was handed to the channel
     */
    Mono<Void> publish(String jobId, JobStatus status, Integer progress);

    /**
     * Tap the live channel of a job.
     *
     * @param jobId job identifier
     * @return unbounded Flux of future events, ends only when the subscriber cancels
     */
    Flux<JobStatusEvent> subscribe(String jobId);

    /**
     * Tap the live channel of a job, waiting until the channel is actually listening.
     * Once the returned Mono has emitted and the inner Flux is subscribed, every later
     * publish for the job reaches that Flux. Callers that read a snapshot of the job
     * should do so only after both steps.
     *
     * @param jobId job identifier
     * @return Mono emitting the live Flux once the subscription is registered
     */
    Mono<Flux<JobStatusEvent>> subscribeWhenReady(String jobId);
}
