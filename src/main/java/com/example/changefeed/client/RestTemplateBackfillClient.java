package com.example.changefeed.client;

import com.example.changefeed.model.dto.NotificationView;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Backfill over {@code GET /api/v1/notifications/since}, retried with the
 * {@code notificationBackfill} Resilience4j retry.
 */
@Slf4j
public class RestTemplateBackfillClient implements NotificationBackfill {

    private final RestTemplate restTemplate;
    private final URI sinceUri;
    private final String userId;
    private final Retry retry;

    public RestTemplateBackfillClient(RestTemplate restTemplate, URI sinceUri, String userId, Retry retry) {
        this.restTemplate = restTemplate;
        this.sinceUri = sinceUri;
        this.userId = userId;
        this.retry = retry;
    }

    @Override
    public List<NotificationView> fetchSince(long lastSeenId) {
        return Retry.decorateSupplier(retry, () -> request(lastSeenId)).get();
    }

    private List<NotificationView> request(long lastSeenId) {
        URI uri = UriComponentsBuilder.fromUri(sinceUri)
                .queryParam("last_seen_id", lastSeenId)
                .build(true)
                .toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.set(NotificationHttpHeaders.USER_ID, userId);
        ResponseEntity<List<NotificationView>> response = restTemplate.exchange(
                uri, HttpMethod.GET, new HttpEntity<>(headers), new ParameterizedTypeReference<>() {});
        List<NotificationView> body = response.getBody();
        log.debug("Backfill since {} returned {} notification(s)", lastSeenId, body != null ? body.size() : 0);
        return body != null ? body : List.of();
    }
}
