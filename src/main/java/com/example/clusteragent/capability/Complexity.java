package com.example.clusteragent.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How demanding a resource type is to use directly.
 */
public enum Complexity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; unknown or missing values map to {@link #MEDIUM}.
     */
    @JsonCreator
    public static Complexity fromValue(String value) {
        if (value == null) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
