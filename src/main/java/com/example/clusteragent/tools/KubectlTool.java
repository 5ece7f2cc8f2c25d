package com.example.clusteragent.tools;

import com.example.clusteragent.agent.AgentTool;
import com.example.clusteragent.agent.ToolResult;
import com.example.clusteragent.cluster.ClusterClient;
import com.example.clusteragent.cluster.ClusterContext;
import com.example.clusteragent.cluster.CommandResult;
import com.example.clusteragent.config.AgentProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of the kubectl tool family registered by the kubernetes plugin.
 * Subclasses translate their typed arguments into a kubectl argument list.
 */
@Slf4j
public abstract class KubectlTool implements AgentTool {

    protected static final Map<String, Object> NAMESPACE_PARAM =
            Map.of("type", "string", "description", "Namespace; omit for the current context's namespace");

    protected final ClusterClient clusterClient;
    protected final AgentProperties properties;
    protected final ObjectMapper objectMapper;

    protected KubectlTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        this.clusterClient = clusterClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    protected ToolResult runKubectl(List<String> args) {
        CommandResult result = clusterClient.run(args, ClusterContext.from(properties.getKubectl()));
        if (!result.isSuccess()) {
            return ToolResult.error(result.errorText(), result.exitCode(), result.stdout());
        }
        return ToolResult.text(result.stdout());
    }

    /**
     * Same as {@link #runKubectl} but parses stdout as JSON into the result data.
     */
    protected ToolResult runKubectlJson(List<String> args) {
        ToolResult result = runKubectl(args);
        if (!result.isSuccess() || result.getOutput() == null || result.getOutput().isBlank()) {
            return result;
        }
        try {
            return ToolResult.json(objectMapper.readTree(result.getOutput()), result.getOutput());
        } catch (JsonProcessingException e) {
            log.warn("{} returned non-JSON output: {}", getName(), e.getOriginalMessage());
            return result;
        }
    }

    protected static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    protected static String string(Map<String, Object> params, String key) {
        Object value = params.get(key);
        return value == null ? null : String.valueOf(value);
    }

    protected static boolean flag(Map<String, Object> params, String key) {
        return Boolean.TRUE.equals(params.get(key));
    }

    protected static void addNamespace(List<String> args, Map<String, Object> params) {
        String namespace = string(params, "namespace");
        if (namespace != null && !namespace.isBlank()) {
            args.add("-n");
            args.add(namespace);
        }
    }
}
