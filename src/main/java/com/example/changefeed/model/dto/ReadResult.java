package com.example.changefeed.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of a mark-read call. {@code readCount} counts notifications whose
 * flag actually changed, so repeating a call reports zero.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReadResult(
        boolean success,
        int readCount
) {
}
