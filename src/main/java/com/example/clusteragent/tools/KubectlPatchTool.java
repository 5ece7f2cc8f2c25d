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
public class KubectlPatchTool extends KubectlTool {

    public KubectlPatchTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_patch"; }

    @Override
    public String getDescription() {
        return "Patch fields of a live resource (kubectl patch), e.g. raise memory limits of a deployment.";
    }

    @Override
    public String getCategory() { return "mutation"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.MUTATING; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "resource", Map.of("type", "string", "description", "Resource type"),
                "name", Map.of("type", "string", "description", "Resource name"),
                "namespace", NAMESPACE_PARAM,
                "patch", Map.of("type", "string", "description", "Patch document as JSON"),
                "type", Map.of("type", "string", "enum", List.of("strategic", "merge", "json"))
        ), List.of("resource", "name", "patch"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        String type = string(parameters, "type");
        List<String> args = new ArrayList<>(List.of("patch",
                string(parameters, "resource"), string(parameters, "name"),
                "--type=" + (type != null ? type : "strategic"),
                "-p", string(parameters, "patch")));
        addNamespace(args, parameters);
        return runKubectl(args);
    }
}
