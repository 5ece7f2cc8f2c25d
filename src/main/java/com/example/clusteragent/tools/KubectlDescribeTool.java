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
public class KubectlDescribeTool extends KubectlTool {

    public KubectlDescribeTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_describe"; }

    @Override
    public String getDescription() {
        return "Describe a resource with its recent events (kubectl describe). " +
               "Best first step when investigating a failing pod or workload.";
    }

    @Override
    public String getCategory() { return "inspection"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.READ_ONLY; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "resource", Map.of("type", "string", "description", "Resource type"),
                "name", Map.of("type", "string", "description", "Resource name"),
                "namespace", NAMESPACE_PARAM
        ), List.of("resource", "name"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("describe",
                string(parameters, "resource"), string(parameters, "name")));
        addNamespace(args, parameters);
        return runKubectl(args);
    }
}
