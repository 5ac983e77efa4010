package com.whereq.scribe.worker;

import com.whereq.scribe.engine.TranscriptionEngine;
import com.whereq.scribe.exception.AudioNotFoundException;
import com.whereq.scribe.exception.InvalidJobTransitionException;
import com.whereq.scribe.exception.JobNotFoundException;
import com.whereq.scribe.exception.TranscriptionException;
import com.whereq.scribe.model.JobUpdate;
import com.whereq.scribe.model.TranscriptionJob;
import com.whereq.scribe.model.TranscriptionResult;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.storage.AudioStorage;
import com.whereq.scribe.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Consumer loop of one worker: Idle → Claimed → Processing → {Completed, Failed} → Idle.
 *
 * The worker owns a job from the moment it dequeues the id. Store or queue failures are
 * not job outcomes: the loop logs them, backs off and carries on.
 */
@Slf4j
public class TranscriptionWorker implements Runnable {

    static final String MDC_JOB_ID = "jobId";

    private final String name;
    private final JobQueue jobQueue;
    private final JobStore jobStore;
    private final TranscriptionEngine engine;
    private final AudioStorage audioStorage;
    private final StopSignal stopSignal;
    private final Clock clock;
    private final Duration pollTimeout;
    private final Duration errorBackoff;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Timer processingTimer;

    public TranscriptionWorker(String name,
                               JobQueue jobQueue,
                               JobStore jobStore,
                               TranscriptionEngine engine,
                               AudioStorage audioStorage,
                               StopSignal stopSignal,
                               Clock clock,
                               Duration pollTimeout,
                               Duration errorBackoff,
                               MeterRegistry meterRegistry) {
        this.name = name;
        this.jobQueue = jobQueue;
        this.jobStore = jobStore;
        this.engine = engine;
        this.audioStorage = audioStorage;
        this.stopSignal = stopSignal;
        this.clock = clock;
        this.pollTimeout = pollTimeout;
        this.errorBackoff = errorBackoff;

        completedCounter = Counter.builder("scribe.jobs.completed")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);

        failedCounter = Counter.builder("scribe.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);

        processingTimer = Timer.builder("scribe.jobs.processing.time")
            .description("Time from claim to terminal state")
            .register(meterRegistry);
    }

    @Override
    public void run() {
        log.info("Worker {} started, waiting for jobs...", name);

        while (!stopSignal.isStopRequested()) {
            try {
                String jobId = jobQueue.dequeue(pollTimeout).block();
                if (jobId != null) {
                    process(jobId);
                }
            } catch (RuntimeException e) {
                log.error("Worker {} error: {}", name, e.getMessage(), e);
                if (backOff()) {
                    break;
                }
            }
        }

        log.info("Worker {} shutting down...", name);
    }

    /**
     * Run one dequeued job to its terminal state.
     */
    void process(String jobId) {
        MDC.put(MDC_JOB_ID, jobId);
        try {
            TranscriptionJob job;
            try {
                job = jobStore.update(jobId, JobUpdate.claimed(clock.instant())).block();
            } catch (JobNotFoundException | InvalidJobTransitionException e) {
                // expired, swept, or already claimed through a duplicate queue entry
                log.warn("Skipping job {}: {}", jobId, e.getMessage());
                return;
            }
            if (job != null) {
                runClaimed(job);
            }
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private void runClaimed(TranscriptionJob job) {
        String jobId = job.getId();
        String audioRef = job.getAudioRef();
        log.info("Processing job {}: {}", jobId,
            job.getParams() != null ? job.getParams().getOriginalFilename() : audioRef);

        Timer.Sample sample = Timer.start();
        try {
            JobUpdate outcome = transcribe(job);
            jobStore.update(jobId, outcome).block();

            if (outcome.getResult() != null) {
                completedCounter.increment();
                log.info("Job {} completed successfully | Duration: {}s | Processing: {}s",
                    jobId, outcome.getResult().getDuration(), outcome.getResult().getProcessingTime());
            } else {
                failedCounter.increment();
            }
        } finally {
            sample.stop(processingTimer);
            deleteAudio(audioRef);
        }
    }

    /**
     * Call the engine and turn its answer into the terminal update
     */
    private JobUpdate transcribe(TranscriptionJob job) {
        long start = System.nanoTime();
        try {
            if (job.getAudioRef() == null || !audioStorage.exists(job.getAudioRef())) {
                throw new AudioNotFoundException(job.getAudioRef());
            }

            TranscriptionResult result = engine.transcribe(job.getAudioRef(), job.getParams());
            if (result == null) {
                throw new TranscriptionException("Engine returned no result");
            }
            result.setProcessingTime((System.nanoTime() - start) / 1_000_000_000.0);

            return JobUpdate.completed(result, clock.instant());
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", job.getId(), e.getMessage());
            return JobUpdate.failed(describe(e), clock.instant());
        }
    }

    private void deleteAudio(String audioRef) {
        if (audioRef == null) {
            return;
        }
        try {
            audioStorage.delete(audioRef);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to delete audio file {}: {}", audioRef, e.getMessage());
        }
    }

    /**
     * @return true if the worker should exit instead of retrying
     */
    private boolean backOff() {
        try {
            return stopSignal.awaitStop(errorBackoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public String getName() {
        return name;
    }
}
