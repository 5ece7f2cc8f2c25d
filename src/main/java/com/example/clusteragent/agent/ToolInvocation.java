package com.example.clusteragent.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only record of one tool execution attempt within a session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolInvocation {

    private String toolName;
    private String pluginId;
    private Map<String, Object> arguments;
    private Instant timestamp;
    private long durationMs;
    private InvocationOutcome outcome;
    private String output;
    private String error;

    /** Structured tool output, kept in memory only */
    @JsonIgnore
    private JsonNode data;

    public boolean isSuccess() {
        return outcome == InvocationOutcome.SUCCEEDED;
    }

    public static ToolInvocation rejected(String toolName, Map<String, Object> arguments, String error) {
        return ToolInvocation.builder()
                .toolName(toolName)
                .arguments(arguments)
                .timestamp(Instant.now())
                .outcome(InvocationOutcome.REJECTED)
                .error(error)
                .build();
    }
}
