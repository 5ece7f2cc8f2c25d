package com.example.clusteragent.plugin;

import java.time.Instant;
import java.util.List;

public record PluginInfo(String id, String name, String version, Source source,
                         List<String> tools, Instant registeredAt) {

    public enum Source {
        BUILT_IN,
        REMOTE
    }
}
