package com.example.clusteragent.agent;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of a single tool execution: raw text output for the model, optional
 * structured data for callers that need to inspect it (e.g. readiness polling).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    @Builder.Default
    private boolean success = true;

    private String output;
    private JsonNode data;
    private String error;
    private Integer exitCode;

    public static ToolResult text(String output) {
        return ToolResult.builder().success(true).output(output).exitCode(0).build();
    }

    public static ToolResult json(JsonNode data, String rawOutput) {
        return ToolResult.builder().success(true).data(data).output(rawOutput).exitCode(0).build();
    }

    public static ToolResult error(String errorMessage) {
        return ToolResult.builder().success(false).error(errorMessage).build();
    }

    public static ToolResult error(String errorMessage, int exitCode, String output) {
        return ToolResult.builder().success(false).error(errorMessage).exitCode(exitCode).output(output).build();
    }

    /**
     * Text handed back to the model: the output on success, "Error: ..." otherwise.
     */
    public String toModelText() {
        if (success) {
            return output != null ? output : (data != null ? data.toString() : "");
        }
        return "Error: " + (error != null ? error : "command failed");
    }
}
