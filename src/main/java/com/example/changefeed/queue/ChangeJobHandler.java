package com.example.changefeed.queue;

import com.example.changefeed.model.dto.ChangeEvent;

/**
 * Consumer side of the job queue. Jobs are delivered at least once; the
 * handler must tolerate redelivery.
 *
 * Throwing {@link com.example.changefeed.exception.RetryableJobException}
 * (or any other runtime exception) asks for a redelivery with backoff,
 * {@link com.example.changefeed.exception.PoisonedJobException} sends the
 * job straight to the dead-letter store.
 */
public interface ChangeJobHandler {

    void handle(ChangeEvent event);
}
