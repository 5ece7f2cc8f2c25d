package com.example.clusteragent.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Tool entry of a remote plugin's describe answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteToolDefinition {
    private String name;
    private String description;
    private Map<String, Object> inputSchema;
    /** Explicit risk marker; when absent the risk is inferred from the tool name */
    private Boolean mutating;
}
