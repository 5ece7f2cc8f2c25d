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

/**
 * Schema documentation of a resource or one of its fields.
 */
@Component
public class KubectlExplainTool extends KubectlTool {

    public KubectlExplainTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_explain"; }

    @Override
    public String getDescription() {
        return "Show the schema of a resource or field path (kubectl explain), e.g. deployment.spec.strategy. " +
               "Use before writing fields you are not sure about.";
    }

    @Override
    public String getCategory() { return "schema"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.READ_ONLY; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "resource", Map.of("type", "string", "description", "Resource or field path"),
                "apiVersion", Map.of("type", "string", "description", "Group/version, e.g. apps/v1"),
                "recursive", Map.of("type", "boolean", "description", "Print all nested fields")
        ), List.of("resource"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("explain", string(parameters, "resource")));
        String apiVersion = string(parameters, "apiVersion");
        if (apiVersion != null && !apiVersion.isBlank()) {
            args.add("--api-version=" + apiVersion);
        }
        if (flag(parameters, "recursive")) {
            args.add("--recursive");
        }
        return runKubectl(args);
    }
}
