package com.example.clusteragent.plugin;

/**
 * In-process plugin. Plugins contribute tools through the {@link PluginApi} they are
 * handed at registration; everything they register is removed again when the plugin
 * is deregistered.
 */
public interface Plugin {

    /**
     * Unique plugin identifier; also the owner key of its tools in the registry.
     */
    String getId();

    String getName();

    String getVersion();

    String getDescription();

    void register(PluginApi api);

    /**
     * Called after the plugin's tools have been removed.
     */
    default void deactivate() {
    }
}
