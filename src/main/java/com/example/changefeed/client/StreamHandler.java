package com.example.changefeed.client;

/**
 * Callbacks of a {@link NotificationStreamTransport}, invoked on the thread
 * that runs {@link NotificationStreamTransport#stream(StreamHandler)}.
 */
public interface StreamHandler {

    /**
     * The server accepted the connection. Called before any event.
     */
    void onOpen();

    /**
     * One event payload (the joined {@code data:} lines of an SSE event).
     */
    void onEvent(String data);
}
