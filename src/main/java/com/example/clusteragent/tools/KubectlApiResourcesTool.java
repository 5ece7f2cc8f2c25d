package com.example.clusteragent.tools;

import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolResult;
import com.example.clusteragent.cluster.ClusterClient;
import com.example.clusteragent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Lists the resource types the cluster serves. Besides the raw table the result
 * carries a JSON array with one object per resource (name, shortNames, apiVersion,
 * group, version, namespaced, kind, verbs), used by the capability scan.
 */
@Component
public class KubectlApiResourcesTool extends KubectlTool {

    private static final List<String> COLUMNS =
            List.of("NAME", "SHORTNAMES", "APIVERSION", "NAMESPACED", "KIND", "VERBS");

    public KubectlApiResourcesTool(ClusterClient clusterClient, AgentProperties properties, ObjectMapper objectMapper) {
        super(clusterClient, properties, objectMapper);
    }

    @Override
    public String getName() { return "kubectl_api_resources"; }

    @Override
    public String getDescription() {
        return "List every resource type available in the cluster, including custom resources " +
               "installed by operators (kubectl api-resources).";
    }

    @Override
    public String getCategory() { return "schema"; }

    @Override
    public RiskClass getRiskClass() { return RiskClass.READ_ONLY; }

    @Override
    public Map<String, Object> getParameterSchema() {
        return objectSchema(Map.of(
                "apiGroup", Map.of("type", "string", "description", "Only resources of this API group")
        ), List.of());
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        List<String> args = new ArrayList<>(List.of("api-resources", "-o", "wide"));
        String apiGroup = string(parameters, "apiGroup");
        if (apiGroup != null) {
            args.add("--api-group=" + apiGroup);
        }
        ToolResult result = runKubectl(args);
        if (!result.isSuccess()) {
            return result;
        }
        return ToolResult.json(parse(result.getOutput()), result.getOutput());
    }

    /**
     * Parses the fixed-width table printed by {@code kubectl api-resources -o wide}.
     * Column boundaries come from the header line.
     */
    ArrayNode parse(String table) {
        ArrayNode resources = objectMapper.createArrayNode();
        if (table == null || table.isBlank()) {
            return resources;
        }
        String[] lines = table.split("\\R");
        String header = lines[0];
        int[] starts = new int[COLUMNS.size()];
        for (int i = 0; i < COLUMNS.size(); i++) {
            starts[i] = header.indexOf(COLUMNS.get(i));
            if (starts[i] < 0) {
                return resources;
            }
        }
        int verbsEnd = header.indexOf("CATEGORIES");

        for (int row = 1; row < lines.length; row++) {
            String line = lines[row];
            if (line.isBlank()) {
                continue;
            }
            String name = column(line, starts[0], starts[1]);
            String shortNames = column(line, starts[1], starts[2]);
            String apiVersion = column(line, starts[2], starts[3]);
            String namespaced = column(line, starts[3], starts[4]);
            String kind = column(line, starts[4], starts[5]);
            String verbs = column(line, starts[5], verbsEnd > 0 ? verbsEnd : line.length());

            ObjectNode resource = resources.addObject();
            resource.put("name", name);
            ArrayNode shorts = resource.putArray("shortNames");
            splitList(shortNames).forEach(shorts::add);
            resource.put("apiVersion", apiVersion);
            int slash = apiVersion.indexOf('/');
            resource.put("group", slash > 0 ? apiVersion.substring(0, slash) : "");
            resource.put("version", slash > 0 ? apiVersion.substring(slash + 1) : apiVersion);
            resource.put("namespaced", Boolean.parseBoolean(namespaced));
            resource.put("kind", kind);
            ArrayNode verbList = resource.putArray("verbs");
            splitList(verbs).forEach(verbList::add);
        }
        return resources;
    }

    private static String column(String line, int start, int end) {
        if (start >= line.length()) {
            return "";
        }
        return line.substring(start, Math.min(end, line.length())).trim();
    }

    private static List<String> splitList(String value) {
        String cleaned = value.replace("[", "").replace("]", "").trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(cleaned.split("[,\\s]+")).filter(s -> !s.isBlank()).toList();
    }
}
