package com.example.clusteragent.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemotePluginDescription {
    private String name;
    private String version;
    @Builder.Default
    private List<RemoteToolDefinition> tools = new ArrayList<>();
}
