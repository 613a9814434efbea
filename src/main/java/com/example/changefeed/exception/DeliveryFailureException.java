package com.example.changefeed.exception;

/**
 * A live channel failed while pushing. The channel is closed; the
 * notification itself stays persisted for backfill.
 */
public class DeliveryFailureException extends RuntimeException {

    public DeliveryFailureException(String message) {
        super(message);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
