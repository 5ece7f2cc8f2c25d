package com.example.clusteragent.tools;

import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolResult;
import com.example.clusteragent.cluster.ClusterClient;
import com.example.clusteragent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Validates a manifest file against the cluster without persisting anything.
 */
@Component
public class KubectlApplyDryRunTool extends KubectlTool {

    public KubectlApplyDryRunTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_apply_dryrun"; }

    @Override
    public String getDescription() {
        return "Dry-run apply of a manifest file (kubectl apply --dry-run). Reports schema errors " +
               "without changing the cluster.";
    }

    @Override
    public String getCategory() { return "schema"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.READ_ONLY; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "file", Map.of("type", "string", "description", "Path of the manifest file"),
                "mode", Map.of("type", "string", "enum", List.of("server", "client"))
        ), List.of("file"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        String mode = string(parameters, "mode");
        if (mode == null) {
            mode = properties.getKubectl().getDryRunMode();
        }
        return runKubectl(List.of("apply", "--dry-run=" + mode, "-f", string(parameters, "file")));
    }
}
