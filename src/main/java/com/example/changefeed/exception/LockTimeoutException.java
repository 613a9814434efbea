package com.example.changefeed.exception;

/**
 * The entity lock could not be obtained in time, or the lease held by the
 * job expired and was force-released before the job committed.
 */
public class LockTimeoutException extends RetryableJobException {

    private final String entityKey;

    public LockTimeoutException(String entityKey, String message) {
        super(message + " [" + entityKey + "]");
        this.entityKey = entityKey;
    }

    public String getEntityKey() {
        return entityKey;
    }
}
