package com.example.clusteragent.agent;

import com.example.clusteragent.error.AgentException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Pulls the JSON document out of a model answer, which may wrap it in prose or a
 * markdown code fence.
 */
public final class ModelJson {

    private ModelJson() {
    }

    public static String extract(String text) {
        if (text == null) {
            throw AgentException.validation("Model returned no content");
        }
        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        int start;
        char close;
        if (objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart)) {
            start = objectStart;
            close = '}';
        } else if (arrayStart >= 0) {
            start = arrayStart;
            close = ']';
        } else {
            throw AgentException.validation("Model answer contains no JSON: " + abbreviate(text));
        }
        int end = text.lastIndexOf(close);
        if (end <= start) {
            throw AgentException.validation("Model answer contains unterminated JSON: " + abbreviate(text));
        }
        return text.substring(start, end + 1);
    }

    public static <T> T parse(ObjectMapper objectMapper, String text, Class<T> type) {
        String json = extract(text);
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw AgentException.validation("Model answer is not a valid " + type.getSimpleName() + ": "
                    + e.getOriginalMessage());
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
