package com.example.clusteragent.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QuestionType {
    TEXT,
    SELECT,
    MULTISELECT,
    BOOLEAN,
    NUMBER;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown types are treated as free text */
    @JsonCreator
    public static QuestionType fromValue(String value) {
        if (value == null) {
            return TEXT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return TEXT;
        }
    }
}
