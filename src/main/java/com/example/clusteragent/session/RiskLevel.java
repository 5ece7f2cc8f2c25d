package com.example.clusteragent.session;

import com.example.clusteragent.capability.Complexity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Risk of a proposed change, ordered from least to most risky.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isAtMost(RiskLevel other) {
        return compareTo(other) <= 0;
    }

    public static RiskLevel of(Complexity complexity) {
        return switch (complexity) {
            case LOW -> LOW;
            case MEDIUM -> MEDIUM;
            case HIGH -> HIGH;
        };
    }
}
