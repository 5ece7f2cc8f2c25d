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
public class KubectlApplyTool extends KubectlTool {

    public KubectlApplyTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_apply"; }

    @Override
    public String getDescription() {
        return "Apply a manifest file to the cluster (kubectl apply -f). Declarative and idempotent: " +
               "existing resources are updated in place.";
    }

    @Override
    public String getCategory() { return "mutation"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.MUTATING; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "file", Map.of("type", "string", "description", "Path of the manifest file"),
                "namespace", NAMESPACE_PARAM
        ), List.of("file"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("apply", "-f", string(parameters, "file")));
        addNamespace(args, parameters);
        return runKubectl(args);
    }
}
