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
public class KubectlScaleTool extends KubectlTool {

    public KubectlScaleTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_scale"; }

    @Override
    public String getDescription() {
        return "Set the replica count of a deployment, statefulset or replicaset (kubectl scale).";
    }

    @Override
    public String getCategory() { return "mutation"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.MUTATING; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "resource", Map.of("type", "string", "enum", List.of("deployment", "statefulset", "replicaset")),
                "name", Map.of("type", "string", "description", "Workload name"),
                "namespace", NAMESPACE_PARAM,
                "replicas", Map.of("type", "integer", "description", "Desired replica count")
        ), List.of("resource", "name", "replicas"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        int replicas = ((Number) parameters.get("replicas")).intValue();
        if (replicas < 0) {
            return ToolResult.error("replicas must not be negative");
        }
        List<String> args = new ArrayList<>(List.of("scale",
                string(parameters, "resource") + "/" + string(parameters, "name"),
                "--replicas=" + replicas));
        addNamespace(args, parameters);
        return runKubectl(args);
    }
}
