package com.example.changefeed.client;

import com.example.changefeed.model.dto.NotificationView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Validates stream payloads. A payload must carry a numeric {@code id}, a
 * string {@code message}, a string {@code type} and a boolean
 * {@code is_read}; anything else is dropped.
 */
@Slf4j
public class NotificationPayloadParser {

    private final ObjectMapper objectMapper;

    public NotificationPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<NotificationView> parse(String data) {
        if (data == null || data.isBlank()) {
            log.warn("Dropping empty notification payload");
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(data);
            String problem = validate(node);
            if (problem != null) {
                log.warn("Dropping malformed notification payload ({}): {}", problem, data);
                return Optional.empty();
            }
            return Optional.of(objectMapper.treeToValue(node, NotificationView.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping unreadable notification payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String validate(JsonNode node) {
        if (node == null || !node.isObject()) {
            return "not an object";
        }
        if (!node.path("id").isIntegralNumber()) {
            return "id";
        }
        if (!node.path("message").isTextual()) {
            return "message";
        }
        if (!node.path("type").isTextual()) {
            return "type";
        }
        if (!node.path("is_read").isBoolean()) {
            return "is_read";
        }
        return null;
    }
}
