package com.example.changefeed.exception;

/**
 * Structurally invalid job. Routed to the dead-letter store and never retried.
 */
public class PoisonedJobException extends RuntimeException {

    public PoisonedJobException(String message) {
        super(message);
    }

    public PoisonedJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
