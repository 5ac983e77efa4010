package com.whereq.scribe.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transcription job lifecycle states
 *
 * State transitions:
 * QUEUED → PROCESSING → {COMPLETED, FAILED}
 *
 * COMPLETED and FAILED are terminal. No other edge exists.
 * Constants are declared in lifecycle order.
 */
public enum JobStatus {
    /**
     * Record written, id waiting in the queue
     */
    QUEUED,

    /**
     * Claimed by a worker, transcription in progress
     */
    PROCESSING,

    /**
     * Completed successfully, result stored
     */
    COMPLETED,

    /**
     * Terminated with error, message stored
     */
    FAILED;

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        TRANSITIONS.put(QUEUED, Collections.unmodifiableSet(EnumSet.of(PROCESSING)));
        TRANSITIONS.put(PROCESSING, Collections.unmodifiableSet(EnumSet.of(COMPLETED, FAILED)));
        TRANSITIONS.put(COMPLETED, Collections.unmodifiableSet(EnumSet.noneOf(JobStatus.class)));
        TRANSITIONS.put(FAILED, Collections.unmodifiableSet(EnumSet.noneOf(JobStatus.class)));
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if the job still waits for or occupies a worker
     */
    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }

    /**
     * Check if moving from this state to {@code next} is a legal edge
     */
    public boolean canTransitionTo(JobStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /**
     * States reachable in one step from this state
     */
    public Set<JobStatus> nextStates() {
        return TRANSITIONS.get(this);
    }
}
