package com.example.clusteragent.deploy;

import com.example.clusteragent.agent.InvocationOutcome;
import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolGateway;
import com.example.clusteragent.agent.ToolInvocation;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.retry.Sleeper;
import com.example.clusteragent.validation.Manifests;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a generated manifest and waits for its workloads. The apply goes through
 * the gateway like any other mutating tool, so it needs an approval in the session
 * history. Readiness polling is bounded by the caller's timeout.
 */
@Slf4j
@Service
public class DeployOperation {

    public static final String MANIFEST_FILE = "manifest.yaml";

    private final ToolGateway gateway;
    private final AgentProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public DeployOperation(ToolGateway gateway, AgentProperties properties) {
        this(gateway, properties, Sleeper.THREAD);
    }

    DeployOperation(ToolGateway gateway, AgentProperties properties, Sleeper sleeper) {
        this.gateway = gateway;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * Deploys {@code <sessionDir>/<solutionId>/manifest.yaml}.
     */
    public DeploymentResult deploy(Path sessionDir, String solutionId, Duration timeout,
                                   ToolContext context, Set<RiskClass> allowedRiskClasses) {
        if (!Files.isDirectory(sessionDir)) {
            throw AgentException.precondition("Session directory does not exist: " + sessionDir);
        }
        Path manifest = sessionDir.resolve(solutionId).resolve(MANIFEST_FILE);
        return deploy(manifest, timeout, context, allowedRiskClasses);
    }

    public DeploymentResult deploy(Path manifest, Duration timeout, ToolContext context,
                                   Set<RiskClass> allowedRiskClasses) {
        if (!Files.isRegularFile(manifest)) {
            throw AgentException.precondition("Manifest file not found: " + manifest);
        }
        List<JsonNode> documents;
        try {
            documents = Manifests.readDocuments(manifest);
        } catch (IOException e) {
            throw AgentException.validation("Manifest is not valid YAML: " + e.getMessage());
        }

        long started = System.currentTimeMillis();
        long deadline = started + timeout.toMillis();
        Duration toolTimeout = Duration.ofSeconds(properties.getWorkflow().getToolTimeoutSeconds());
        List<ToolInvocation> invocations = new ArrayList<>();

        ToolInvocation apply = gateway.invoke("kubectl_apply", Map.of("file", manifest.toString()),
                allowedRiskClasses, context, toolTimeout);
        invocations.add(apply);
        if (!apply.isSuccess()) {
            boolean applyTimedOut = apply.getOutcome() == InvocationOutcome.TIMED_OUT;
            if (applyTimedOut) {
                log.warn("Apply of {} timed out for session {}; it may still have been applied: {}",
                        manifest, context.getSessionId(), apply.getError());
            } else {
                log.warn("Apply of {} failed for session {}: {}", manifest, context.getSessionId(), apply.getError());
            }
            return DeploymentResult.builder()
                    .success(false)
                    .applyTimeout(applyTimedOut)
                    .manifestPath(manifest.toString())
                    .output(apply.getOutput())
                    .error(apply.getError())
                    .durationMs(System.currentTimeMillis() - started)
                    .invocations(invocations)
                    .build();
        }
        log.info("Applied {} for session {}", manifest, context.getSessionId());

        Map<String, ResourceRef> pending = new LinkedHashMap<>();
        for (JsonNode doc : documents) {
            ResourceRef ref = ResourceRef.of(doc);
            if (ReadinessEvaluator.requiresReadiness(ref.kind())) {
                pending.put(ref.toString(), ref);
            }
        }

        // latest status call per resource; earlier polls are not kept
        Map<String, ToolInvocation> lastStatus = new LinkedHashMap<>();
        long interval = properties.getDeploy().getPollIntervalMs();
        while (!pending.isEmpty()) {
            pending.entrySet().removeIf(entry ->
                    isReady(entry.getKey(), entry.getValue(), allowedRiskClasses, context, deadline, toolTimeout, lastStatus));
            long remaining = deadline - System.currentTimeMillis();
            if (pending.isEmpty() || remaining <= 0) {
                break;
            }
            try {
                sleeper.sleep(Math.min(interval, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw AgentException.internal("Interrupted while waiting for readiness of " + manifest, e);
            }
        }

        invocations.addAll(lastStatus.values());
        boolean timedOut = !pending.isEmpty();
        if (timedOut) {
            log.warn("Readiness timeout after {} ms for session {}; not ready: {}", timeout.toMillis(),
                    context.getSessionId(), pending.keySet());
        }
        return DeploymentResult.builder()
                .success(true)
                .readinessTimeout(timedOut)
                .manifestPath(manifest.toString())
                .output(apply.getOutput())
                .notReady(new ArrayList<>(pending.keySet()))
                .durationMs(System.currentTimeMillis() - started)
                .invocations(invocations)
                .build();
    }

    private boolean isReady(String key, ResourceRef ref, Set<RiskClass> allowedRiskClasses, ToolContext context,
                            long deadline, Duration toolTimeout, Map<String, ToolInvocation> lastStatus) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("resource", ref.kubectlResource());
        args.put("name", ref.name());
        if (ref.namespace() != null) {
            args.put("namespace", ref.namespace());
        }
        args.put("output", "json");

        long remaining = Math.max(deadline - System.currentTimeMillis(), 100);
        Duration bound = Duration.ofMillis(Math.min(toolTimeout.toMillis(), remaining));
        ToolInvocation get = gateway.invoke("kubectl_get", args, allowedRiskClasses, context, bound);
        lastStatus.put(key, get);
        if (!get.isSuccess() || get.getData() == null) {
            log.debug("Status of {} not available yet: {}", ref, get.getError());
            return false;
        }
        boolean ready = ReadinessEvaluator.isReady(get.getData());
        log.debug("{} ready={}", ref, ready);
        return ready;
    }
}
