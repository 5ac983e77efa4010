package com.whereq.scribe.exception;

/**
 * Exception thrown when the pending queue is at its configured maximum size
 */
public class QuotaExceededException extends RuntimeException {
    public QuotaExceededException(String message) {
        super(message);
    }
}
