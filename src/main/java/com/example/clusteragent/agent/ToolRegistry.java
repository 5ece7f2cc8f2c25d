package com.example.clusteragent.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of every tool made available by the loaded plugins.
 * Tools are keyed by (pluginId, toolName); a secondary name index resolves the
 * plugin that currently owns a tool name. A later registration of an existing
 * name takes the name over with a warning.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<ToolKey, AgentTool> tools = new ConcurrentHashMap<>();
    private final Map<String, ToolKey> nameIndex = new ConcurrentHashMap<>();

    private record ToolKey(String pluginId, String toolName) {
    }

    public synchronized void register(String pluginId, AgentTool tool) {
        ToolKey key = new ToolKey(pluginId, tool.getName());
        ToolKey previous = nameIndex.put(tool.getName(), key);
        if (previous != null && !previous.equals(key)) {
            tools.remove(previous);
            log.warn("Tool '{}' from plugin '{}' replaces the one from plugin '{}'",
                    tool.getName(), pluginId, previous.pluginId());
        }
        tools.put(key, tool);
        log.info("Registered tool: {} ({}, {}) from plugin {}",
                tool.getName(), tool.getCategory(), tool.getRiskClass(), pluginId);
    }

    public void registerAll(String pluginId, List<? extends AgentTool> pluginTools) {
        pluginTools.forEach(tool -> register(pluginId, tool));
    }

    /**
     * Remove every tool registered by the plugin. Returns the number of tools removed.
     */
    public synchronized int deregisterPlugin(String pluginId) {
        List<ToolKey> owned = tools.keySet().stream()
                .filter(key -> key.pluginId().equals(pluginId))
                .toList();
        for (ToolKey key : owned) {
            tools.remove(key);
            nameIndex.remove(key.toolName(), key);
        }
        if (!owned.isEmpty()) {
            log.info("Deregistered {} tools of plugin {}", owned.size(), pluginId);
        }
        return owned.size();
    }

    public Optional<RegisteredTool> getTool(String name) {
        ToolKey key = nameIndex.get(name);
        if (key == null) {
            return Optional.empty();
        }
        AgentTool tool = tools.get(key);
        return tool == null ? Optional.empty() : Optional.of(new RegisteredTool(key.pluginId(), tool));
    }

    public List<AgentTool> getAllTools() {
        return new ArrayList<>(tools.values());
    }

    /**
     * Tools whose risk class is in the allowed set; what the model gets to see in a phase.
     */
    public List<AgentTool> getToolsForRiskClasses(Set<RiskClass> allowed) {
        return tools.values().stream()
                .filter(tool -> allowed.contains(tool.getRiskClass()))
                .sorted(Comparator.comparing(AgentTool::getName))
                .collect(Collectors.toList());
    }

    public List<String> getToolNamesForPlugin(String pluginId) {
        return tools.keySet().stream()
                .filter(key -> key.pluginId().equals(pluginId))
                .map(ToolKey::toolName)
                .sorted()
                .toList();
    }

    public List<Map<String, Object>> listToolsDetailed() {
        return tools.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<ToolKey, AgentTool> e) -> e.getValue().getCategory())
                        .thenComparing(e -> e.getValue().getName()))
                .map(entry -> {
                    AgentTool tool = entry.getValue();
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("name", tool.getName());
                    info.put("plugin", entry.getKey().pluginId());
                    info.put("category", tool.getCategory());
                    info.put("description", tool.getDescription());
                    info.put("riskClass", tool.getRiskClass());
                    return info;
                })
                .collect(Collectors.toList());
    }

    public int getToolCount() {
        return tools.size();
    }
}
