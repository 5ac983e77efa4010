package com.whereq.scribe.exception;

/**
 * Exception thrown when an update or lookup names a job the store does not hold
 */
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
