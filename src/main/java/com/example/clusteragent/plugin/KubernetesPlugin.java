package com.example.clusteragent.plugin;

import com.example.clusteragent.tools.KubectlTool;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Built-in plugin contributing the kubectl tool family.
 */
@Component
@RequiredArgsConstructor
public class KubernetesPlugin implements Plugin {

    private final List<KubectlTool> tools;

    @Override
    public String getId() { return "kubernetes"; }

    @Override
    public String getName() { return "Kubernetes"; }

    @Override
    public String getVersion() { return "1.0.0"; }

    @Override
    public String getDescription() {
        return "kubectl based inspection, validation and mutation tools";
    }

    @Override
    public void register(PluginApi api) {
        tools.forEach(api::registerTool);
    }
}
