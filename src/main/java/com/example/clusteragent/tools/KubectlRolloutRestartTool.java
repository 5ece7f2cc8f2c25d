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
public class KubectlRolloutRestartTool extends KubectlTool {

    public KubectlRolloutRestartTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_rollout_restart"; }

    @Override
    public String getDescription() {
        return "Restart the pods of a workload with a rolling update (kubectl rollout restart).";
    }

    @Override
    public String getCategory() { return "mutation"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.MUTATING; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "resource", Map.of("type", "string", "enum", List.of("deployment", "statefulset", "daemonset")),
                "name", Map.of("type", "string", "description", "Workload name"),
                "namespace", NAMESPACE_PARAM
        ), List.of("resource", "name"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("rollout", "restart",
                string(parameters, "resource") + "/" + string(parameters, "name")));
        addNamespace(args, parameters);
        return runKubectl(args);
    }
}
