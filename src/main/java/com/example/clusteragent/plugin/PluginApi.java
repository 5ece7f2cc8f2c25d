package com.example.clusteragent.plugin;

import com.example.clusteragent.agent.AgentTool;
import com.example.clusteragent.agent.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * The surface a plugin sees while registering. Bound to one plugin id so a plugin can
 * only add tools under its own name.
 */
@Slf4j
public class PluginApi {

    private final String pluginId;
    private final ToolRegistry toolRegistry;
    private final List<String> registeredTools = new ArrayList<>();

    PluginApi(String pluginId, ToolRegistry toolRegistry) {
        this.pluginId = pluginId;
        this.toolRegistry = toolRegistry;
    }

    public void registerTool(AgentTool tool) {
        toolRegistry.register(pluginId, tool);
        registeredTools.add(tool.getName());
    }

    public String getPluginId() {
        return pluginId;
    }

    List<String> getRegisteredTools() {
        return List.copyOf(registeredTools);
    }
}
