package com.example.clusteragent.plugin;

import com.example.clusteragent.agent.ToolRegistry;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.config.AgentProperties.PluginConfig.RemotePlugin;
import com.example.clusteragent.retry.Backoff;
import com.example.clusteragent.retry.BackoffConfig;
import com.example.clusteragent.retry.FailureClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads plugins and keeps the tool registry in sync with them.
 *
 * Loading flow:
 * 1. built-in plugins (Spring beans) register at application start
 * 2. remote plugins are discovered through their describe hook, at start and then
 *    periodically, on the discovery scheduler
 * 3. a failed discovery is retried with exponential backoff by rescheduling the
 *    attempt, so no thread ever sleeps and callers never wait on discovery
 */
@Slf4j
@Service
public class PluginManager {

    private final ToolRegistry toolRegistry;
    private final List<Plugin> builtInPlugins;
    private final RemotePluginClient remoteClient;
    private final AgentProperties properties;
    private final TaskScheduler scheduler;

    private final Map<String, PluginInfo> activePlugins = new ConcurrentHashMap<>();
    private final Map<String, Plugin> localPlugins = new ConcurrentHashMap<>();
    private final Set<String> discoveriesInFlight = ConcurrentHashMap.newKeySet();

    public PluginManager(ToolRegistry toolRegistry, List<Plugin> builtInPlugins,
                         RemotePluginClient remoteClient, AgentProperties properties,
                         @Qualifier("discoveryScheduler") TaskScheduler scheduler) {
        this.toolRegistry = toolRegistry;
        this.builtInPlugins = builtInPlugins;
        this.remoteClient = remoteClient;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        builtInPlugins.forEach(this::registerPlugin);
        discover();
        long interval = properties.getPlugins().getDiscoveryIntervalMs();
        if (interval > 0) {
            scheduler.scheduleAtFixedRate(this::discover, Instant.now().plusMillis(interval),
                    Duration.ofMillis(interval));
        }
        log.info("Plugin loading started: {} built-in, {} remote configured, {} tools available",
                builtInPlugins.size(), properties.getPlugins().getRemote().size(), toolRegistry.getToolCount());
    }

    /**
     * Register an in-process plugin, replacing an earlier registration with the same id.
     */
    public PluginInfo registerPlugin(Plugin plugin) {
        if (activePlugins.containsKey(plugin.getId())) {
            deregisterPlugin(plugin.getId());
        }
        PluginApi api = new PluginApi(plugin.getId(), toolRegistry);
        plugin.register(api);
        localPlugins.put(plugin.getId(), plugin);
        PluginInfo info = new PluginInfo(plugin.getId(), plugin.getName(), plugin.getVersion(),
                PluginInfo.Source.BUILT_IN, api.getRegisteredTools(), Instant.now());
        activePlugins.put(plugin.getId(), info);
        log.info("Loaded plugin: {} v{} - {} ({} tools)", plugin.getName(), plugin.getVersion(),
                plugin.getDescription(), info.tools().size());
        return info;
    }

    /**
     * Register the tools a remote plugin described.
     */
    public PluginInfo registerRemote(RemotePlugin config, RemotePluginDescription description) {
        if (activePlugins.containsKey(config.getName())) {
            deregisterPlugin(config.getName());
        }
        PluginApi api = new PluginApi(config.getName(), toolRegistry);
        description.getTools().forEach(tool -> api.registerTool(new RemotePluginTool(config, tool, remoteClient)));
        PluginInfo info = new PluginInfo(config.getName(), description.getName(), description.getVersion(),
                PluginInfo.Source.REMOTE, api.getRegisteredTools(), Instant.now());
        activePlugins.put(config.getName(), info);
        log.info("Discovered remote plugin {} v{} at {} ({} tools)", config.getName(),
                description.getVersion(), config.getUrl(), info.tools().size());
        return info;
    }

    public boolean deregisterPlugin(String pluginId) {
        PluginInfo removed = activePlugins.remove(pluginId);
        if (removed == null) {
            return false;
        }
        toolRegistry.deregisterPlugin(pluginId);
        Plugin local = localPlugins.remove(pluginId);
        if (local != null) {
            local.deactivate();
        }
        log.info("Deactivated plugin: {}", pluginId);
        return true;
    }

    /**
     * Schedule a discovery attempt for every configured remote plugin that is not active
     * and has no attempt chain running. Returns immediately.
     */
    public int discover() {
        int scheduled = 0;
        for (RemotePlugin remote : properties.getPlugins().getRemote()) {
            if (activePlugins.containsKey(remote.getName()) || !discoveriesInFlight.add(remote.getName())) {
                continue;
            }
            scheduler.schedule(() -> attemptDiscovery(remote, 0), Instant.now());
            scheduled++;
        }
        return scheduled;
    }

    void attemptDiscovery(RemotePlugin remote, int attempt) {
        AgentProperties.PluginConfig cfg = properties.getPlugins();
        try {
            registerRemote(remote, remoteClient.describe(remote));
            discoveriesInFlight.remove(remote.getName());
        } catch (RuntimeException e) {
            boolean retry = attempt + 1 < cfg.getDiscoveryRetries() && FailureClassifier.isTransient(e);
            if (remote.isRequired()) {
                log.error("Required plugin {} unavailable (attempt {}/{}): {}", remote.getName(),
                        attempt + 1, cfg.getDiscoveryRetries(), e.getMessage());
            } else {
                log.warn("Plugin {} unavailable (attempt {}/{}): {}", remote.getName(),
                        attempt + 1, cfg.getDiscoveryRetries(), e.getMessage());
            }
            if (!retry) {
                discoveriesInFlight.remove(remote.getName());
                return;
            }
            BackoffConfig backoff = BackoffConfig.of(cfg.getDiscoveryInitialDelayMs(), 2.0, cfg.getDiscoveryMaxDelayMs());
            long delay = Backoff.delay(attempt, backoff);
            scheduler.schedule(() -> attemptDiscovery(remote, attempt + 1), Instant.now().plusMillis(delay));
        }
    }

    /**
     * Configured plugins marked required that are not currently registered.
     */
    public List<String> getUnavailableRequired() {
        return properties.getPlugins().getRemote().stream()
                .filter(RemotePlugin::isRequired)
                .map(RemotePlugin::getName)
                .filter(name -> !activePlugins.containsKey(name))
                .toList();
    }

    public List<PluginInfo> listPlugins() {
        List<PluginInfo> plugins = new ArrayList<>(activePlugins.values());
        plugins.sort(Comparator.comparing(PluginInfo::id));
        return plugins;
    }
}
