package com.example.changefeed.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Entities whose tracked fields are written to the change history.
 */
public enum EntityType {
    INVOICE_LINE_ITEM("invoice_line_item"),
    CAMPAIGN("campaign"),
    LINE_ITEM("line_item"),
    COMMENT("comment");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves the wire name of an entity type.
     *
     * @return the matching type, or {@code null} for unknown names so that
     *         validation can reject the event instead of failing deserialization
     */
    @JsonCreator
    public static EntityType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (EntityType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
