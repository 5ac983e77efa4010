package com.whereq.scribe.exception;

/**
 * Exception thrown when uploaded audio cannot be written to the shared storage
 */
public class AudioStorageException extends RuntimeException {
    public AudioStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
