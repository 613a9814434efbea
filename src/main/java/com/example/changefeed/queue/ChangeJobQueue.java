package com.example.changefeed.queue;

import com.example.changefeed.model.dto.ChangeEvent;

/**
 * Durable, at-least-once queue of change jobs keyed by entity. Jobs of one
 * entity are handed to the {@link ChangeJobHandler} one at a time, in
 * enqueue order.
 */
public interface ChangeJobQueue {

    /**
     * Hands the event to the queue without waiting for it to be processed.
     *
     * @throws com.example.changefeed.exception.QueueUnavailableException if
     *         the queue cannot take the job right now
     */
    void enqueue(ChangeEvent event);
}
