package com.whereq.scribe.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Broadcast on every job state change
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusEvent {
    private String jobId;
    private JobStatus status;

    /**
     * Null when the update left progress unchanged
     */
    private Integer progress;

    private Instant timestamp;

    /**
     * True if this event reports a later point of the lifecycle than {@code previous}:
     * a later status, or the same status with higher progress. Nothing follows a terminal event.
     */
    public boolean supersedes(JobStatusEvent previous) {
        if (previous.getStatus().isTerminal()) {
            return false;
        }
        if (status != previous.getStatus()) {
            return status.ordinal() > previous.getStatus().ordinal();
        }
        return progress != null && (previous.getProgress() == null || progress > previous.getProgress());
    }

    public static JobStatusEvent of(String jobId, JobStatus status, Integer progress) {
        return new JobStatusEvent(jobId, status, progress, Instant.now());
    }
}
