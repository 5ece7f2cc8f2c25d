package com.example.clusteragent.agent;

import java.util.Map;

/**
 * Contract for every tool the agent can invoke on the cluster.
 * Tools are registered by plugins and never change after registration:
 * - name: unique identifier exposed to the model
 * - description: guidance for the model on when to use the tool
 * - riskClass: read-only or mutating, used by the gateway's phase gating
 * - parameterSchema: JSON schema the arguments are validated against
 */
public interface AgentTool {

    /**
     * Unique tool name (e.g., "kubectl_get", "kubectl_apply").
     */
    String getName();

    /**
     * Human-readable description for the model.
     */
    String getDescription();

    /**
     * Category of this tool (inspection, mutation, schema, ...).
     */
    String getCategory();

    RiskClass getRiskClass();

    /**
     * JSON Schema describing the parameters this tool accepts.
     */
    Map<String, Object> getParameterSchema();

    /**
     * Execute the tool. Implementations may block; the gateway bounds them with a timeout.
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);

    default boolean isMutating() {
        return getRiskClass() == RiskClass.MUTATING;
    }
}
