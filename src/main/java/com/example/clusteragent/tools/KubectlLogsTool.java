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
public class KubectlLogsTool extends KubectlTool {

    private static final int DEFAULT_TAIL = 200;

    public KubectlLogsTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_logs"; }

    @Override
    public String getDescription() {
        return "Read container logs of a pod (kubectl logs). Set previous=true to read the " +
               "logs of the last crashed container.";
    }

    @Override
    public String getCategory() { return "inspection"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.READ_ONLY; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "pod", Map.of("type", "string", "description", "Pod name"),
                "namespace", NAMESPACE_PARAM,
                "container", Map.of("type", "string", "description", "Container name for multi-container pods"),
                "previous", Map.of("type", "boolean", "description", "Logs of the previous container instance"),
                "tail", Map.of("type", "integer", "description", "Number of lines from the end, default 200")
        ), List.of("pod"));
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("logs", string(parameters, "pod")));
        addNamespace(args, parameters);
        String container = string(parameters, "container");
        if (container != null && !container.isBlank()) {
            args.add("-c");
            args.add(container);
        }
        if (flag(parameters, "previous")) {
            args.add("--previous");
        }
        Object tail = parameters.get("tail");
        int lines = tail instanceof Number number ? number.intValue() : DEFAULT_TAIL;
        args.add("--tail=" + lines);
        return runKubectl(args);
    }
}
