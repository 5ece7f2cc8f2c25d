package com.example.clusteragent.controller;

import com.example.clusteragent.agent.ToolRegistry;
import com.example.clusteragent.plugin.PluginInfo;
import com.example.clusteragent.plugin.PluginManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Registered tools and the plugins that provide them.
 */
@RestController
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final PluginManager pluginManager;

    @GetMapping("/api/tools")
    public ResponseEntity<List<Map<String, Object>>> listTools() {
        return ResponseEntity.ok(toolRegistry.listToolsDetailed());
    }

    @GetMapping("/api/plugins")
    public ResponseEntity<Map<String, Object>> listPlugins() {
        List<PluginInfo> plugins = pluginManager.listPlugins();
        return ResponseEntity.ok(Map.of(
                "plugins", plugins,
                "toolCount", toolRegistry.getToolCount(),
                "unavailableRequired", pluginManager.getUnavailableRequired()));
    }

    /**
     * Trigger discovery of remote plugins now instead of waiting for the next interval.
     */
    @PostMapping("/api/plugins/discover")
    public ResponseEntity<Map<String, Object>> discover() {
        return ResponseEntity.ok(Map.of("scheduled", pluginManager.discover()));
    }

    @DeleteMapping("/api/plugins/{id}")
    public ResponseEntity<Void> deregister(@PathVariable String id) {
        return pluginManager.deregisterPlugin(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
