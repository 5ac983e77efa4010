package com.whereq.scribe.dto;

import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.TranscriptionJob;
import com.whereq.scribe.model.TranscriptionParams;
import com.whereq.scribe.model.TranscriptionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    private String jobId;
    private JobStatus status;

    /**
     * Progress percentage, 0-100
     */
    private int progress;

    private TranscriptionParams params;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    /**
     * Transcript (if completed)
     */
    private TranscriptionResult result;

    /**
     * Error message (if failed)
     */
    private String error;

    public static JobStatusResponse from(TranscriptionJob job) {
        return JobStatusResponse.builder()
            .jobId(job.getId())
            .status(job.getStatus())
            .progress(job.getProgress())
            .params(job.getParams())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .result(job.getResult())
            .error(job.getError())
            .build();
    }
}
