package com.example.changefeed.service.fanout;

import com.example.changefeed.model.dto.NotificationView;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Transport end of a live channel. Calls come from a single sender thread
 * per channel.
 */
public interface ChannelSink {

    void send(NotificationView notification) throws IOException;

    void sendHeartbeat() throws IOException;

    void complete();

    void completeWithError(Throwable cause);

    /**
     * Registers what to run when the client side goes away: {@code onClosed}
     * on disconnect or timeout, {@code onError} on a transport error.
     */
    void onTermination(Runnable onClosed, Consumer<Throwable> onError);
}
