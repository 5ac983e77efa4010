package com.whereq.scribe.notify;

import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobStatusEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process status notifier. Each job with at least one subscriber owns a
 * best-effort multicast sink; the sink is dropped when its last subscriber leaves.
 */
@Slf4j
public class InMemoryStatusNotifier implements StatusNotifier {

    private final ConcurrentMap<String, Channel> channels = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> publish(String jobId, JobStatus status, Integer progress) {
        return Mono.fromRunnable(() -> {
            Channel channel = channels.get(jobId);
            if (channel == null) {
                log.trace("No subscribers for job {}, dropping {}", jobId, status);
                return;
            }
            Sinks.EmitResult result = channel.sink.tryEmitNext(JobStatusEvent.of(jobId, status, progress));
            if (result.isFailure()) {
                log.warn("Status event {} for job {} not delivered: {}", status, jobId, result);
            }
        });
    }

    @Override
    public Flux<JobStatusEvent> subscribe(String jobId) {
        return Flux.defer(() -> {
            Channel channel = channels.compute(jobId, (id, existing) -> {
                Channel c = existing != null ? existing : new Channel();
                c.subscribers++;
                return c;
            });
            return channel.sink.asFlux()
                .doFinally(signal -> release(jobId));
        });
    }

    /**
     * The in-process channel registers and listens as soon as the inner Flux is subscribed.
     */
    @Override
    public Mono<Flux<JobStatusEvent>> subscribeWhenReady(String jobId) {
        return Mono.fromSupplier(() -> subscribe(jobId));
    }

    int channelCount() {
        return channels.size();
    }

    private void release(String jobId) {
        channels.computeIfPresent(jobId, (id, c) -> --c.subscribers == 0 ? null : c);
    }

    private static final class Channel {
        // guarded by the map's per-key compute
        private int subscribers;
        private final Sinks.Many<JobStatusEvent> sink = Sinks.many().multicast().directBestEffort();
    }
}
