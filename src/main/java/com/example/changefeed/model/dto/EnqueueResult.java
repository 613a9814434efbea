package com.example.changefeed.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer of the enqueue operation. Accepted means the event will eventually
 * be processed, not that it has been.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnqueueResult(
        boolean accepted,
        String reason
) {

    public static EnqueueResult ok() {
        return new EnqueueResult(true, null);
    }

    public static EnqueueResult rejected(String reason) {
        return new EnqueueResult(false, reason);
    }
}
