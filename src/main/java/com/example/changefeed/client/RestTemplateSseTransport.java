package com.example.changefeed.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-Sent Events transport over {@link RestTemplate}. Reads the response
 * line by line: {@code data:} lines are joined into one event, a blank line
 * dispatches it, comment lines (heartbeats) are skipped.
 */
@Slf4j
public class RestTemplateSseTransport implements NotificationStreamTransport {

    private final RestTemplate restTemplate;
    private final URI streamUri;
    private final String userId;
    private final AtomicReference<ClientHttpResponse> current = new AtomicReference<>();

    public RestTemplateSseTransport(RestTemplate restTemplate, URI streamUri, String userId) {
        this.restTemplate = restTemplate;
        this.streamUri = streamUri;
        this.userId = userId;
    }

    @Override
    public void stream(StreamHandler handler) {
        restTemplate.execute(streamUri, HttpMethod.GET,
                request -> {
                    request.getHeaders().setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
                    request.getHeaders().set(NotificationHttpHeaders.USER_ID, userId);
                },
                response -> {
                    current.set(response);
                    try {
                        handler.onOpen();
                        readEvents(response, handler);
                    } finally {
                        current.compareAndSet(response, null);
                    }
                    return null;
                });
    }

    @Override
    public void abort() {
        ClientHttpResponse response = current.getAndSet(null);
        if (response != null) {
            response.close();
        }
    }

    private void readEvents(ClientHttpResponse response, StreamHandler handler) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
            StringBuilder data = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    if (data.length() > 0) {
                        handler.onEvent(data.toString());
                        data.setLength(0);
                    }
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(stripLeadingSpace(line.substring(5)));
                } else if (!line.startsWith(":")) {
                    log.trace("Ignoring stream field: {}", line);
                }
            }
        } catch (IOException e) {
            if (current.get() == null) {
                log.debug("Stream read ended after local abort: {}", e.getMessage());
                return;
            }
            throw e;
        }
    }

    private static String stripLeadingSpace(String value) {
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
