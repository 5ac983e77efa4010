package com.whereq.scribe.service;

import com.whereq.scribe.config.ScribeProperties;
import com.whereq.scribe.exception.QuotaExceededException;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.storage.AudioStorage;
import com.whereq.scribe.store.JobStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Submission path: validate, store the audio, write the job record, then enqueue its id.
 *
 * The record is written before the id is enqueued. If enqueueing fails the submission still
 * succeeds: the record stays QUEUED without a queue entry until {@link OrphanedJobReconciler}
 * enqueues it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSubmissionService {

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final AudioStorage audioStorage;
    private final Validator validator;
    private final ScribeProperties properties;

    /**
     * Submit audio for async transcription
     *
     * @param content uploaded audio
     * @param originalFilename client-side file name
     * @param params engine parameters
     * @return Mono with the job id
     */
    public Mono<String> submit(Flux<DataBuffer> content, String originalFilename, TranscriptionParams params) {
        return Mono.fromCallable(() -> validate(params.toBuilder().originalFilename(originalFilename).build()))
            .flatMap(validated -> jobQueue.isFull(properties.getQueue().getMaxSize())
                .flatMap(full -> {
                    if (full) {
                        return Mono.error(new QuotaExceededException(
                            "Queue is full, cannot accept more jobs"));
                    }
                    return audioStorage.store(content, originalFilename);
                })
                .flatMap(audioRef -> createJob(audioRef, validated)))
            .flatMap(jobId -> jobQueue.enqueue(jobId)
                .onErrorResume(e -> {
                    log.error("Job {} written but not enqueued, left for reconciliation: {}",
                        jobId, e.getMessage());
                    return Mono.empty();
                })
                .thenReturn(jobId))
            .doOnSuccess(jobId -> log.info("Job {} submitted: {}", jobId, originalFilename))
            .doOnError(e -> log.error("Job submission failed for {}: {}", originalFilename, e.getMessage()));
    }

    /**
     * Create the record, removing the stored audio again if that fails
     */
    private Mono<String> createJob(String audioRef, TranscriptionParams params) {
        return jobStore.create(audioRef, params)
            .onErrorResume(e -> {
                discardAudio(audioRef);
                return Mono.error(e);
            });
    }

    TranscriptionParams validate(TranscriptionParams params) {
        Set<ConstraintViolation<TranscriptionParams>> violations = validator.validate(params);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid parameters: " + message);
        }
        return params;
    }

    private void discardAudio(String audioRef) {
        try {
            audioStorage.delete(audioRef);
        } catch (IOException e) {
            log.warn("Failed to delete audio file {}: {}", audioRef, e.getMessage());
        }
    }
}
