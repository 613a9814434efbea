package com.example.changefeed.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

/**
 * One tracked field transition inside a {@link ChangeEvent}.
 *
 * @param field    name of the tracked field, e.g. {@code adjustments}
 * @param oldValue previous value, {@code null} when the field was unset
 * @param newValue value after the change
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldChange(
        String field,
        Object oldValue,
        Object newValue
) {

    @JsonIgnore
    public boolean isNoOp() {
        return Objects.equals(oldValue, newValue);
    }
}
