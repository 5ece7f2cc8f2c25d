package com.example.clusteragent.deploy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Readiness rules per workload kind. Kinds without a rule are ready as soon as
 * they have been applied.
 */
public final class ReadinessEvaluator {

    private static final Set<String> WORKLOAD_KINDS =
            Set.of("Deployment", "StatefulSet", "ReplicaSet", "DaemonSet", "Job", "Pod");

    private ReadinessEvaluator() {
    }

    public static boolean requiresReadiness(String kind) {
        return WORKLOAD_KINDS.contains(kind);
    }

    public static boolean isReady(JsonNode object) {
        String kind = object.path("kind").asText();
        JsonNode spec = object.path("spec");
        JsonNode status = object.path("status");
        switch (kind) {
            case "Deployment":
            case "StatefulSet":
            case "ReplicaSet": {
                int desired = spec.path("replicas").asInt(1);
                return status.path("readyReplicas").asInt(0) >= desired;
            }
            case "DaemonSet": {
                int desired = status.path("desiredNumberScheduled").asInt(-1);
                return desired >= 0 && status.path("numberReady").asInt(0) >= desired;
            }
            case "Job": {
                int completions = spec.path("completions").asInt(1);
                return status.path("succeeded").asInt(0) >= completions;
            }
            case "Pod": {
                String phase = status.path("phase").asText();
                if ("Succeeded".equals(phase)) {
                    return true;
                }
                return "Running".equals(phase) && podReadyCondition(status);
            }
            default:
                return true;
        }
    }

    private static boolean podReadyCondition(JsonNode status) {
        for (JsonNode condition : status.path("conditions")) {
            if ("Ready".equals(condition.path("type").asText())) {
                return "True".equals(condition.path("status").asText());
            }
        }
        return false;
    }
}
