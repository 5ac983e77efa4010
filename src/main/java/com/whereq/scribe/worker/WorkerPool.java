package com.whereq.scribe.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * Runs a fixed number of {@link TranscriptionWorker}s on dedicated threads.
 *
 * Stopping raises the shared {@link StopSignal} and waits for in-flight jobs to finish;
 * a running job is never interrupted.
 */
@Slf4j
public class WorkerPool implements SmartLifecycle {

    private final int workerCount;
    private final Duration shutdownTimeout;
    private final BiFunction<String, StopSignal, TranscriptionWorker> workerFactory;

    private volatile StopSignal stopSignal;
    private volatile ExecutorService executor;

    public WorkerPool(int workerCount,
                      Duration shutdownTimeout,
                      BiFunction<String, StopSignal, TranscriptionWorker> workerFactory) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
        this.workerCount = workerCount;
        this.shutdownTimeout = shutdownTimeout;
        this.workerFactory = workerFactory;
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        stopSignal = new StopSignal();
        executor = Executors.newFixedThreadPool(workerCount, new CustomizableThreadFactory("transcription-worker-"));

        for (int i = 0; i < workerCount; i++) {
            executor.execute(workerFactory.apply("worker-" + i, stopSignal));
        }

        log.info("Worker pool started with {} workers", workerCount);
    }

    @Override
    public synchronized void stop() {
        if (!isRunning()) {
            return;
        }
        log.info("Stopping worker pool, waiting up to {} for in-flight jobs", shutdownTimeout);
        stopSignal.requestStop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still busy after {}, leaving them to finish", shutdownTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Worker pool stopped");
    }

    @Override
    public boolean isRunning() {
        return executor != null;
    }

    public int getWorkerCount() {
        return workerCount;
    }
}
