package com.example.changefeed.exception;

/**
 * The job queue could not take a job at enqueue time. The caller may retry
 * the enqueue; nothing was recorded.
 */
public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
