package com.whereq.scribe.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Partial update of a job record. Null fields are left untouched.
 */
@Value
@Builder
public class JobUpdate {
    JobStatus status;
    Integer progress;
    TranscriptionResult result;
    String error;
    Instant startedAt;
    Instant completedAt;

    public static final int CLAIMED_PROGRESS = 10;
    public static final int COMPLETED_PROGRESS = 100;

    /**
     * Worker took ownership of the job
     */
    public static JobUpdate claimed(Instant now) {
        return JobUpdate.builder()
            .status(JobStatus.PROCESSING)
            .progress(CLAIMED_PROGRESS)
            .startedAt(now)
            .build();
    }

    public static JobUpdate completed(TranscriptionResult result, Instant now) {
        return JobUpdate.builder()
            .status(JobStatus.COMPLETED)
            .progress(COMPLETED_PROGRESS)
            .result(result)
            .completedAt(now)
            .build();
    }

    /**
     * Progress is left where it was
     */
    public static JobUpdate failed(String error, Instant now) {
        return JobUpdate.builder()
            .status(JobStatus.FAILED)
            .error(error)
            .completedAt(now)
            .build();
    }

    public boolean isEmpty() {
        return status == null && progress == null && result == null
            && error == null && startedAt == null && completedAt == null;
    }
}
