package com.plainer.collab.client.content;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictStrategy {
    LAST_WRITE_WINS("last-write-wins"),
    OPERATIONAL_TRANSFORM("operational-transform"),
    MERGE("merge");

    private final String value;

    ConflictStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Accepts the hyphenated form used in configuration as well as the constant name. */
    public static ConflictStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return LAST_WRITE_WINS;
        }
        String normalized = value.trim();
        for (ConflictStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(normalized) || strategy.name().equalsIgnoreCase(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown conflict strategy: " + value);
    }
}
