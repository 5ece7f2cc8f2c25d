package com.example.clusteragent.tools;

import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolResult;
import com.example.clusteragent.cluster.ClusterClient;
import com.example.clusteragent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class KubectlGetTool extends KubectlTool {

    public KubectlGetTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_get"; }

    @Override
    public String getDescription() {
        return "List or fetch Kubernetes resources (kubectl get). Use output=json for full objects " +
               "including status, or wide for a quick overview.";
    }

    @Override
    public String getCategory() { return "inspection"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.READ_ONLY; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "resource", Map.of("type", "string", "description", "Resource type, e.g. pods, deployments.apps"),
                "name", Map.of("type", "string", "description", "Resource name; omit to list"),
                "namespace", NAMESPACE_PARAM,
                "allNamespaces", Map.of("type", "boolean", "description", "List across all namespaces"),
                "selector", Map.of("type", "string", "description", "Label selector, e.g. app=web"),
                "output", Map.of("type", "string", "enum", List.of("json", "yaml", "wide", "name"))
        ), List.of("resource"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("get", string(parameters, "resource")));
        String name = string(parameters, "name");
        if (name != null && !name.isBlank()) {
            args.add(name);
        }
        if (flag(parameters, "allNamespaces")) {
            args.add("-A");
        } else {
            addNamespace(args, parameters);
        }
        String selector = string(parameters, "selector");
        if (selector != null && !selector.isBlank()) {
            args.add("-l");
            args.add(selector);
        }
        String output = string(parameters, "output");
        if (output != null) {
            args.add("-o");
            args.add(output);
        }
        return "json".equals(output) ? runKubectlJson(args) : runKubectl(args);
    }
}
