package com.example.changefeed.service.fanout;

import com.example.changefeed.model.dto.NotificationView;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * {@link ChannelSink} over a Server-Sent Events response. Each notification
 * is one {@code data:} event carrying the notification JSON, heartbeats are
 * {@code : heartbeat} comments.
 */
public class SseChannelSink implements ChannelSink {

    static final String HEARTBEAT_COMMENT = "heartbeat";

    private final SseEmitter emitter;

    public SseChannelSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    /**
     * Emitter without a server-side timeout, so idle or background clients
     * stay connected until they leave.
     */
    public static SseChannelSink withoutTimeout() {
        return new SseChannelSink(new SseEmitter(0L));
    }

    public SseEmitter getEmitter() {
        return emitter;
    }

    @Override
    public void send(NotificationView notification) throws IOException {
        emitter.send(SseEmitter.event()
                .id(String.valueOf(notification.id()))
                .data(notification, MediaType.APPLICATION_JSON));
    }

    @Override
    public void sendHeartbeat() throws IOException {
        emitter.send(SseEmitter.event().comment(HEARTBEAT_COMMENT));
    }

    @Override
    public void complete() {
        emitter.complete();
    }

    @Override
    public void completeWithError(Throwable cause) {
        emitter.completeWithError(cause);
    }

    @Override
    public void onTermination(Runnable onClosed, Consumer<Throwable> onError) {
        emitter.onCompletion(onClosed);
        emitter.onTimeout(onClosed);
        emitter.onError(onError);
    }
}
