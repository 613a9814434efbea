package com.example.changefeed.client;

/**
 * One long-lived push connection.
 */
public interface NotificationStreamTransport {

    /**
     * Connects and delivers events until the stream ends. Returns when the
     * server closes the stream; throws when connecting or reading fails.
     */
    void stream(StreamHandler handler);

    /**
     * Closes the current connection, if any, making {@link #stream} return.
     */
    void abort();
}
