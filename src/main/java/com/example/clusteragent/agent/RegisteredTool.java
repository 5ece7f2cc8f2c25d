package com.example.clusteragent.agent;

/**
 * A tool together with the id of the plugin that provides it.
 */
public record RegisteredTool(String pluginId, AgentTool tool) {

    public String name() {
        return tool.getName();
    }
}
