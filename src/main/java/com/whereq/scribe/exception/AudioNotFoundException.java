package com.whereq.scribe.exception;

/**
 * Exception thrown when a job's audio is gone by the time a worker is ready to process it
 */
public class AudioNotFoundException extends RuntimeException {
    public AudioNotFoundException(String audioRef) {
        super("Audio file not found: " + audioRef);
    }
}
