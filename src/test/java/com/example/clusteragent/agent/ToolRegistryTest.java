package com.example.clusteragent.agent;

import com.example.clusteragent.support.StubTool;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private final ToolRegistry registry = new ToolRegistry();

    @Test
    void resolvesToolsAndTheirPlugin() {
        registry.registerAll("kubernetes", List.of(
                new StubTool("kubectl_get", RiskClass.READ_ONLY),
                new StubTool("kubectl_apply", RiskClass.MUTATING)));

        RegisteredTool registered = registry.getTool("kubectl_apply").orElseThrow();
        assertEquals("kubernetes", registered.pluginId());
        assertEquals("kubectl_apply", registered.name());
        assertEquals(2, registry.getToolCount());
        assertTrue(registry.getTool("missing").isEmpty());
    }

    @Test
    void filtersByRiskClassSortedByName() {
        registry.registerAll("kubernetes", List.of(
                new StubTool("kubectl_logs", RiskClass.READ_ONLY),
                new StubTool("kubectl_delete", RiskClass.MUTATING),
                new StubTool("kubectl_events", RiskClass.READ_ONLY)));

        List<String> readOnly = registry.getToolsForRiskClasses(EnumSet.of(RiskClass.READ_ONLY)).stream()
                .map(AgentTool::getName).toList();

        assertEquals(List.of("kubectl_events", "kubectl_logs"), readOnly);
        assertTrue(registry.getToolsForRiskClasses(EnumSet.noneOf(RiskClass.class)).isEmpty());
    }

    @Test
    void laterPluginTakesOverToolName() {
        registry.register("kubernetes", new StubTool("describe", RiskClass.READ_ONLY));
        registry.register("remote-db", new StubTool("describe", RiskClass.READ_ONLY));

        assertEquals("remote-db", registry.getTool("describe").orElseThrow().pluginId());
        assertEquals(1, registry.getToolCount());
        assertTrue(registry.getToolNamesForPlugin("kubernetes").isEmpty());
    }

    @Test
    void deregisteringPluginRemovesOnlyItsTools() {
        registry.register("kubernetes", new StubTool("kubectl_get", RiskClass.READ_ONLY));
        registry.register("remote-db", new StubTool("db_query", RiskClass.READ_ONLY));
        registry.register("remote-db", new StubTool("db_restart", RiskClass.MUTATING));

        assertEquals(2, registry.deregisterPlugin("remote-db"));
        assertEquals(List.of("kubectl_get"), registry.getAllTools().stream().map(AgentTool::getName).toList());
        assertTrue(registry.getTool("db_query").isEmpty());
        assertEquals(0, registry.deregisterPlugin("remote-db"));
    }
}
