package com.example.changefeed.exception;

/**
 * Transient failure while processing a job. The job goes back to the queue
 * and is redelivered with backoff until its attempts run out.
 */
public class RetryableJobException extends RuntimeException {

    public RetryableJobException(String message) {
        super(message);
    }

    public RetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
