package com.whereq.scribe.store;

import com.whereq.scribe.exception.InvalidJobTransitionException;
import com.whereq.scribe.model.JobStatus;
import com.whereq.scribe.model.JobUpdate;
import com.whereq.scribe.model.TranscriptionJob;

import java.time.Instant;
import java.util.Comparator;

/**
 * Lifecycle rules shared by the job store backends.
 */
final class JobRecords {

    /**
     * Newest first; records without a creation time sort last.
     */
    static final Comparator<TranscriptionJob> NEWEST_FIRST = Comparator.comparing(
        TranscriptionJob::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed();

    private JobRecords() {
    }

    /**
     * Apply {@code update} to a copy of {@code current}.
     *
     * Entering PROCESSING stamps startedAt and entering a terminal state stamps
     * completedAt when the update does not carry them.
     *
     * @throws InvalidJobTransitionException if the update breaks the lifecycle
     */
    static TranscriptionJob merge(TranscriptionJob current, JobUpdate update, Instant now) {
        String id = current.getId();
        JobStatus from = current.getStatus();
        JobStatus to = update.getStatus() != null ? update.getStatus() : from;

        if (update.isEmpty()) {
            return current.toBuilder().build();
        }
        if (from.isTerminal()) {
            throw new InvalidJobTransitionException(id, from, "terminal jobs are immutable");
        }
        if (to != from && !from.canTransitionTo(to)) {
            throw new InvalidJobTransitionException(id, from, to);
        }

        TranscriptionJob.TranscriptionJobBuilder merged = current.toBuilder().status(to);

        if (update.getProgress() != null) {
            int progress = update.getProgress();
            if (progress < 0 || progress > 100) {
                throw new InvalidJobTransitionException(id, from, "progress out of range: " + progress);
            }
            if (progress < current.getProgress()) {
                throw new InvalidJobTransitionException(id, from,
                    "progress may not decrease (" + current.getProgress() + " -> " + progress + ")");
            }
            merged.progress(progress);
        }

        if (update.getResult() != null && to != JobStatus.COMPLETED) {
            throw new InvalidJobTransitionException(id, from, "result is only stored with COMPLETED");
        }
        if (update.getError() != null && to != JobStatus.FAILED) {
            throw new InvalidJobTransitionException(id, from, "error is only stored with FAILED");
        }
        if (to == JobStatus.COMPLETED && update.getResult() == null) {
            throw new InvalidJobTransitionException(id, from, "COMPLETED requires a result");
        }
        if (to == JobStatus.FAILED && update.getError() == null) {
            throw new InvalidJobTransitionException(id, from, "FAILED requires an error message");
        }
        merged.result(update.getResult() != null ? update.getResult() : current.getResult());
        merged.error(update.getError() != null ? update.getError() : current.getError());

        Instant startedAt = update.getStartedAt();
        if (startedAt == null && to == JobStatus.PROCESSING && from != JobStatus.PROCESSING) {
            startedAt = now;
        }
        if (startedAt != null) {
            if (current.getStartedAt() != null) {
                throw new InvalidJobTransitionException(id, from, "startedAt is already set");
            }
            merged.startedAt(startedAt);
        }

        Instant completedAt = update.getCompletedAt();
        if (completedAt == null && to.isTerminal()) {
            completedAt = now;
        }
        if (completedAt != null) {
            if (current.getCompletedAt() != null) {
                throw new InvalidJobTransitionException(id, from, "completedAt is already set");
            }
            merged.completedAt(completedAt);
        }

        return merged.build();
    }

    /**
     * Terminal and completed before the cutoff
     */
    static boolean isExpired(TranscriptionJob job, Instant cutoff) {
        return job.isTerminal()
            && job.getCompletedAt() != null
            && job.getCompletedAt().isBefore(cutoff);
    }
}
