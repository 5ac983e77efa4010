package com.whereq.scribe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored state of one transcription job.
 *
 * Written by the submission path at creation, then only by the worker that claimed it.
 * {@code result} is set iff status is COMPLETED, {@code error} iff status is FAILED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionJob {
    /**
     * Unique job identifier
     */
    private String id;

    /**
     * Current status
     */
    private JobStatus status;

    /**
     * Handle of the stored audio, resolved through AudioStorage
     */
    private String audioRef;

    /**
     * Engine parameters
     */
    private TranscriptionParams params;

    /**
     * Progress percentage, 0-100
     */
    private int progress;

    /**
     * When the job was created
     */
    private Instant createdAt;

    /**
     * When a worker claimed the job
     */
    private Instant startedAt;

    /**
     * When the job reached a terminal state
     */
    private Instant completedAt;

    /**
     * Engine output (if completed)
     */
    private TranscriptionResult result;

    /**
     * Error message (if failed)
     */
    private String error;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
