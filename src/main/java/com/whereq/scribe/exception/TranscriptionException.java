package com.whereq.scribe.exception;

/**
 * Exception thrown when the transcription engine fails.
 *
 * The message is stored verbatim as the job's error, so keep it readable.
 */
public class TranscriptionException extends RuntimeException {

    public TranscriptionException(String message) {
        super(message);
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
