package com.whereq.scribe.exception;

import com.whereq.scribe.model.JobStatus;

/**
 * Exception thrown when an update would break the job lifecycle:
 * an illegal status edge, a decreasing progress value, or an outcome
 * field that does not match the target status.
 */
public class InvalidJobTransitionException extends RuntimeException {

    public InvalidJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Illegal transition for job " + jobId + ": " + from + " -> " + to);
    }

    public InvalidJobTransitionException(String jobId, JobStatus current, String message) {
        super("Rejected update for job " + jobId + " in status " + current + ": " + message);
    }
}
