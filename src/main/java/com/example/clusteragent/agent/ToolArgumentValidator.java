package com.example.clusteragent.agent;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema the tools declare:
 * required properties, primitive types and enums.
 */
@Component
public class ToolArgumentValidator {

    /**
     * Returns the list of violations; empty when the arguments are acceptable.
     */
    @SuppressWarnings("unchecked")
    public List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> problems = new ArrayList<>();
        if (schema == null || schema.isEmpty()) {
            return problems;
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        Object required = schema.get("required");
        if (required instanceof Collection<?> names) {
            for (Object name : names) {
                Object value = args.get(String.valueOf(name));
                if (value == null || (value instanceof String s && s.isBlank())) {
                    problems.add("missing required argument '" + name + "'");
                }
            }
        }

        Object properties = schema.get("properties");
        if (!(properties instanceof Map<?, ?> props)) {
            return problems;
        }
        for (Map.Entry<String, Object> arg : args.entrySet()) {
            Object propSchema = props.get(arg.getKey());
            if (arg.getValue() == null || !(propSchema instanceof Map<?, ?>)) {
                continue;
            }
            Map<String, Object> prop = (Map<String, Object>) propSchema;
            Object type = prop.get("type");
            if (type instanceof String expected && !matchesType(expected, arg.getValue())) {
                problems.add("argument '" + arg.getKey() + "' must be of type " + expected);
            }
            Object allowed = prop.get("enum");
            if (allowed instanceof Collection<?> values && !values.contains(arg.getValue())) {
                problems.add("argument '" + arg.getKey() + "' must be one of " + values);
            }
        }
        return problems;
    }

    private static boolean matchesType(String expected, Object value) {
        return switch (expected) {
            case "string" -> value instanceof String;
            case "integer" -> value instanceof Integer || value instanceof Long
                    || (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()));
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "array" -> value instanceof Collection<?>;
            case "object" -> value instanceof Map<?, ?>;
            default -> true;
        };
    }
}
