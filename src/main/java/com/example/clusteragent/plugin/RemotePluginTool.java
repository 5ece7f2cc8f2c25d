package com.example.clusteragent.plugin;

import com.example.clusteragent.agent.AgentTool;
import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolResult;
import com.example.clusteragent.config.AgentProperties.PluginConfig.RemotePlugin;
import com.example.clusteragent.error.AgentException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A tool served by a remote plugin. Execution is an invoke hook round-trip.
 */
public class RemotePluginTool implements AgentTool {

    static final Set<String> READ_ONLY_VERBS =
            Set.of("get", "describe", "list", "logs", "events", "explain", "top", "status");

    static final Set<String> MUTATING_VERBS = Set.of("apply", "create", "delete", "remove", "patch", "update",
            "set", "reset", "scale", "restart", "rollback", "upgrade", "install", "uninstall", "lock", "unlock",
            "drop", "write", "exec", "run", "kill", "evict", "drain", "cordon", "uncordon", "purge");

    private final RemotePlugin plugin;
    private final RemoteToolDefinition definition;
    private final RemotePluginClient client;
    private final RiskClass riskClass;

    public RemotePluginTool(RemotePlugin plugin, RemoteToolDefinition definition, RemotePluginClient client) {
        this.plugin = plugin;
        this.definition = definition;
        this.client = client;
        this.riskClass = classify(definition);
    }

    /**
     * Explicit {@code mutating} flag wins. Otherwise a tool is read-only only when the last
     * segment of its name (split on '_', '-' or '.') is a read-only verb and no segment is a
     * mutating verb, e.g. {@code kubectl_get} or {@code helm.status}. Everything else,
     * including {@code get_or_create_namespace}, is treated as mutating.
     */
    static RiskClass classify(RemoteToolDefinition definition) {
        if (definition.getMutating() != null) {
            return definition.getMutating() ? RiskClass.MUTATING : RiskClass.READ_ONLY;
        }
        String[] segments = definition.getName().toLowerCase(Locale.ROOT).split("[_\\-.]");
        for (String segment : segments) {
            if (MUTATING_VERBS.contains(segment)) {
                return RiskClass.MUTATING;
            }
        }
        return READ_ONLY_VERBS.contains(segments[segments.length - 1]) ? RiskClass.READ_ONLY : RiskClass.MUTATING;
    }

    @Override
    public String getName() {
        return definition.getName();
    }

    @Override
    public String getDescription() {
        return definition.getDescription() != null ? definition.getDescription() : "";
    }

    @Override
    public String getCategory() {
        return "remote:" + plugin.getName();
    }

    @Override
    public RiskClass getRiskClass() {
        return riskClass;
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return definition.getInputSchema() != null ? definition.getInputSchema() : Map.of("type", "object");
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        JsonNode response;
        try {
            response = client.invoke(plugin, definition.getName(), parameters,
                    context.getPluginState(), context.getSessionId());
        } catch (AgentException e) {
            return ToolResult.error(e.getMessage());
        }
        if (!response.path("success").asBoolean(false)) {
            JsonNode error = response.path("error");
            String code = error.path("code").asText("PLUGIN_ERROR");
            return ToolResult.error(code + ": " + error.path("message").asText("remote tool failed"));
        }
        JsonNode result = response.path("result");
        String text = result.isTextual() ? result.asText() : result.toString();
        return ToolResult.builder().success(true).output(text).data(result).build();
    }
}
