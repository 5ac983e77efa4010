package com.whereq.scribe.controller;

import com.whereq.scribe.config.ScribeProperties;
import com.whereq.scribe.dto.JobStatusResponse;
import com.whereq.scribe.dto.QueueStatsResponse;
import com.whereq.scribe.dto.TranscriptionForm;
import com.whereq.scribe.dto.TranscriptionSubmitResponse;
import com.whereq.scribe.exception.QuotaExceededException;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobStatusEvent;
import com.whereq.scribe.model.TaskKind;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.notify.StatusNotifier;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.service.JobSubmissionService;
import com.whereq.scribe.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Controller for async transcription job submission and status
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/transcriptions")
@Tag(name = "Transcriptions", description = "Async transcription jobs")
public class TranscriptionJobController {

    static final int MAX_LIST_LIMIT = 1000;

    @Autowired
    private JobSubmissionService jobSubmissionService;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private StatusNotifier statusNotifier;

    @Autowired
    private ScribeProperties properties;

    /**
     * Submit audio for async transcription
     *
     * @param form multipart upload with engine parameters
     * @return Mono with 202 Accepted response
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Submit audio", description = "Queue an audio file for transcription and return the job id")
    public Mono<ResponseEntity<TranscriptionSubmitResponse>> submit(@ModelAttribute TranscriptionForm form) {
        if (form.getFile() == null) {
            return Mono.just(ResponseEntity.badRequest()
                .body(TranscriptionSubmitResponse.error("Missing 'file' part")));
        }
        String filename = form.getFile().filename();

        log.info("Received transcription submission: file={}, task={}, language={}",
            filename, form.getTask(), form.getLanguage());

        return Mono.fromCallable(() -> toParams(form))
            .flatMap(params -> jobSubmissionService.submit(form.getFile().content(), filename, params))
            .map(jobId -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/transcriptions/" + jobId))
                .body(TranscriptionSubmitResponse.builder()
                    .jobId(jobId)
                    .status(JobStatus.QUEUED)
                    .submittedAt(Instant.now())
                    .build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(TranscriptionSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(QuotaExceededException.class, e -> {
                log.error("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(TranscriptionSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(TranscriptionSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with the job record, 404 if unknown or expired
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Get job", description = "Status, progress and, once finished, result or error of a job")
    public Mono<ResponseEntity<JobStatusResponse>> getJob(@PathVariable String jobId) {
        return jobStore.get(jobId)
            .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .onErrorResume(e -> {
                log.error("Error reading job {}", jobId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    /**
     * List jobs, newest first
     *
     * @param status optional status filter
     * @param limit maximum number of jobs
     * @return Mono with the jobs
     */
    @GetMapping
    @Operation(summary = "List jobs", description = "Newest first, optionally filtered by status. Scans the whole store.")
    public Mono<ResponseEntity<List<JobStatusResponse>>> listJobs(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") int limit) {

        JobStatus filter;
        try {
            filter = status != null ? JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)) : null;
        } catch (IllegalArgumentException e) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            return Mono.just(ResponseEntity.badRequest().build());
        }

        return jobStore.list(filter, limit)
            .map(JobStatusResponse::from)
            .collectList()
            .map(ResponseEntity::ok);
    }

    /**
     * Stream status changes of a job as server-sent events.
     * The stream ends after the terminal event; for finished jobs it carries only the final state.
     *
     * @param jobId job identifier
     * @return Mono with the event stream, 404 if unknown
     */
    @GetMapping(value = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Watch job", description = "Live status events until the job finishes")
    public Mono<ResponseEntity<Flux<ServerSentEvent<JobStatusEvent>>>> watchJob(@PathVariable String jobId) {
        return jobStore.get(jobId)
            .map(job -> {
                Flux<JobStatusEvent> events;
                if (job.isTerminal()) {
                    events = Flux.just(snapshot(job.getId(), job.getStatus(), job.getProgress()));
                } else {
                    // the snapshot is read only after the live channel is listening
                    events = statusNotifier.subscribeWhenReady(jobId)
                        .flatMapMany(live -> Flux.merge(
                            live,
                            jobStore.get(jobId).map(current ->
                                snapshot(current.getId(), current.getStatus(), current.getProgress()))))
                        .transform(TranscriptionJobController::dropStale)
                        .takeUntil(event -> event.getStatus().isTerminal());
                }
                return ResponseEntity.ok(events.map(event -> ServerSentEvent.builder(event)
                    .event("status")
                    .build()));
            })
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Get queue statistics
     */
    @GetMapping("/queue")
    @Operation(summary = "Queue stats", description = "Number of jobs waiting for a worker")
    public Mono<ResponseEntity<QueueStatsResponse>> queueStats() {
        return jobQueue.size()
            .map(size -> ResponseEntity.ok(QueueStatsResponse.builder()
                .pending(size)
                .maxSize(properties.getQueue().getMaxSize())
                .build()));
    }

    /**
     * Pass only events that move the job forward, so a late snapshot or a
     * duplicate never goes backwards on the stream
     */
    static Flux<JobStatusEvent> dropStale(Flux<JobStatusEvent> events) {
        return Flux.defer(() -> {
            AtomicReference<JobStatusEvent> last = new AtomicReference<>();
            return events.filter(event -> {
                JobStatusEvent previous = last.get();
                if (previous != null && !event.supersedes(previous)) {
                    log.debug("Dropping stale event {} after {}", event.getStatus(), previous.getStatus());
                    return false;
                }
                last.set(event);
                return true;
            });
        });
    }

    private static JobStatusEvent snapshot(String jobId, JobStatus status, int progress) {
        return JobStatusEvent.of(jobId, status, progress);
    }

    static TranscriptionParams toParams(TranscriptionForm form) {
        TranscriptionParams.TranscriptionParamsBuilder builder = TranscriptionParams.builder();
        if (form.getLanguage() != null && !form.getLanguage().isBlank()) {
            builder.language(form.getLanguage().trim());
        }
        if (form.getTask() != null) {
            builder.task(TaskKind.parse(form.getTask()));
        }
        if (form.getBeamSize() != null) {
            builder.beamSize(form.getBeamSize());
        }
        if (form.getVadFilter() != null) {
            builder.vadFilter(form.getVadFilter());
        }
        if (form.getWordTimestamps() != null) {
            builder.wordTimestamps(form.getWordTimestamps());
        }
        if (form.getEnableDiarization() != null) {
            builder.enableDiarization(form.getEnableDiarization());
        }
        builder.minSpeakers(form.getMinSpeakers());
        builder.maxSpeakers(form.getMaxSpeakers());
        return builder.build();
    }
}
