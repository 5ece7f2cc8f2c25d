package com.example.clusteragent.plugin;

import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolRegistry;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.config.AgentProperties.PluginConfig.RemotePlugin;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.support.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PluginManagerTest {

    private ToolRegistry registry;
    private RemotePluginClient client;
    private TaskScheduler scheduler;
    private AgentProperties properties;
    private PluginManager manager;
    private final List<Instant> scheduledAt = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        client = mock(RemotePluginClient.class);
        scheduler = mock(TaskScheduler.class);
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            scheduledAt.add(invocation.getArgument(1));
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        });
        properties = new AgentProperties();
        properties.getPlugins().setDiscoveryRetries(3);
        manager = new PluginManager(registry, List.of(new FixturePlugin()), client, properties, scheduler);
    }

    @Test
    void builtInPluginRegistersItsTools() {
        PluginInfo info = manager.registerPlugin(new FixturePlugin());

        assertEquals(PluginInfo.Source.BUILT_IN, info.source());
        assertEquals(List.of("fixture_get", "fixture_restart"), info.tools());
        assertEquals("fixture", registry.getTool("fixture_get").orElseThrow().pluginId());
    }

    @Test
    void deregisteringRemovesToolsAndDeactivates() {
        FixturePlugin plugin = new FixturePlugin();
        manager.registerPlugin(plugin);

        assertTrue(manager.deregisterPlugin("fixture"));

        assertEquals(0, registry.getToolCount());
        assertTrue(plugin.deactivated);
        assertFalse(manager.deregisterPlugin("fixture"));
    }

    @Test
    void remotePluginIsDiscoveredWithInferredRiskClasses() {
        RemotePlugin remote = remote("db", false);
        properties.getPlugins().getRemote().add(remote);
        when(client.describe(remote)).thenReturn(RemotePluginDescription.builder()
                .name("db-tools").version("2.1")
                .tools(List.of(
                        RemoteToolDefinition.builder().name("db_tables_list").build(),
                        RemoteToolDefinition.builder().name("db_vacuum").build()))
                .build());

        assertEquals(1, manager.discover());

        PluginInfo info = manager.listPlugins().get(0);
        assertEquals(PluginInfo.Source.REMOTE, info.source());
        assertEquals(RiskClass.READ_ONLY, registry.getTool("db_tables_list").orElseThrow().tool().getRiskClass());
        assertEquals(RiskClass.MUTATING, registry.getTool("db_vacuum").orElseThrow().tool().getRiskClass());
        assertEquals(0, manager.discover(), "active plugins are not rediscovered");
    }

    @Test
    void transientDiscoveryFailureIsRescheduledWithBackoff() {
        RemotePlugin remote = remote("flaky", false);
        properties.getPlugins().getRemote().add(remote);
        when(client.describe(remote))
                .thenThrow(AgentException.transientFailure("connection refused", null))
                .thenReturn(RemotePluginDescription.builder().name("flaky").version("1")
                        .tools(List.of(RemoteToolDefinition.builder().name("flaky_get").build())).build());

        manager.discover();

        verify(client, times(2)).describe(remote);
        assertEquals(2, scheduledAt.size());
        assertTrue(scheduledAt.get(1).isAfter(scheduledAt.get(0)));
        assertTrue(registry.getTool("flaky_get").isPresent());
    }

    @Test
    void requiredPluginThatStaysDownIsReported() {
        RemotePlugin remote = remote("vault", true);
        properties.getPlugins().getRemote().add(remote);
        when(client.describe(remote)).thenThrow(AgentException.transientFailure("connection refused", null));

        manager.discover();

        verify(client, times(3)).describe(remote);
        assertEquals(List.of("vault"), manager.getUnavailableRequired());
        assertTrue(manager.listPlugins().isEmpty());
    }

    @Test
    void permanentDiscoveryFailureIsNotRetried() {
        RemotePlugin remote = remote("broken", false);
        properties.getPlugins().getRemote().add(remote);
        when(client.describe(remote)).thenThrow(AgentException.validation("invalid description"));

        manager.discover();

        verify(client, times(1)).describe(remote);
        assertEquals(1, manager.discover(), "a finished attempt chain can be started again");
    }

    private static RemotePlugin remote(String name, boolean required) {
        RemotePlugin remote = new RemotePlugin();
        remote.setName(name);
        remote.setUrl("http://localhost:9/" + name);
        remote.setRequired(required);
        return remote;
    }

    private static class FixturePlugin implements Plugin {

        boolean deactivated;

        @Override
        public String getId() {
            return "fixture";
        }

        @Override
        public String getName() {
            return "Fixture";
        }

        @Override
        public String getVersion() {
            return "0.0.1";
        }

        @Override
        public String getDescription() {
            return "tools for tests";
        }

        @Override
        public void register(PluginApi api) {
            api.registerTool(new StubTool("fixture_get", RiskClass.READ_ONLY));
            api.registerTool(new StubTool("fixture_restart", RiskClass.MUTATING));
        }

        @Override
        public void deactivate() {
            deactivated = true;
        }
    }
}
