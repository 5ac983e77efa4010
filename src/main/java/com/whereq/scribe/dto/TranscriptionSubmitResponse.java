package com.whereq.scribe.dto;

import com.whereq.scribe.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for transcription job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Current job status
     */
    private JobStatus status;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static TranscriptionSubmitResponse error(String message) {
        return TranscriptionSubmitResponse.builder()
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
