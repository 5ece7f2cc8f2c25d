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
public class KubectlEventsTool extends KubectlTool {

    public KubectlEventsTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_events"; }

    @Override
    public String getDescription() {
        return "List cluster events sorted by time, optionally only those about one object " +
               "(e.g. involvedObject.name=web-7d9f).";
    }

    @Override
    public String getCategory() { return "inspection"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.READ_ONLY; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "namespace", NAMESPACE_PARAM,
                "fieldSelector", Map.of("type", "string", "description", "Event field selector")
        ), List.of());
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("get", "events", "--sort-by=.lastTimestamp"));
        addNamespace(args, parameters);
        String fieldSelector = string(parameters, "fieldSelector");
        if (fieldSelector != null && !fieldSelector.isBlank()) {
            args.add("--field-selector");
            args.add(fieldSelector);
        }
        return runKubectl(args);
    }
}
