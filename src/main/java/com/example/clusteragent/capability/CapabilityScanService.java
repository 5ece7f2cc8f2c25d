package com.example.clusteragent.capability;

import com.example.clusteragent.agent.InvocationOutcome;
import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolGateway;
import com.example.clusteragent.agent.ToolInvocation;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers the cluster's resource types through the read-only kubectl tools and
 * indexes each of them. One resource failing does not stop the scan.
 */
@Slf4j
@Service
public class CapabilityScanService {

    private static final Set<RiskClass> READ_ONLY = EnumSet.of(RiskClass.READ_ONLY);

    private final ToolGateway gateway;
    private final CapabilityIndex index;
    private final AgentProperties properties;
    private final TaskScheduler scheduler;

    public CapabilityScanService(ToolGateway gateway, CapabilityIndex index, AgentProperties properties,
                                 @Qualifier("discoveryScheduler") TaskScheduler scheduler) {
        this.gateway = gateway;
        this.index = index;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleRescans() {
        AgentProperties.CapabilityConfig cfg = properties.getCapabilities();
        if (!cfg.isScheduledScanEnabled()) {
            return;
        }
        scheduler.scheduleAtFixedRate(this::scheduledScan, Instant.now().plusMillis(cfg.getScanIntervalMs()),
                Duration.ofMillis(cfg.getScanIntervalMs()));
        log.info("Capability rescan scheduled every {} ms", cfg.getScanIntervalMs());
    }

    private void scheduledScan() {
        try {
            scan(properties.getCapabilities().getScanResources());
        } catch (RuntimeException e) {
            log.error("Scheduled capability scan failed", e);
        }
    }

    /**
     * Scan the cluster. An empty or null resource list means every discovered resource.
     */
    public ScanReport scan(List<String> resources) {
        ToolContext context = ToolContext.system("capability-scan");
        ToolInvocation listing = gateway.invoke("kubectl_api_resources", Map.of(), READ_ONLY, context, toolTimeout());
        if (!listing.isSuccess() || listing.getData() == null) {
            ErrorKind kind = listing.getOutcome() == InvocationOutcome.TIMED_OUT
                    ? ErrorKind.TIMEOUT : ErrorKind.PRECONDITION;
            throw new AgentException(kind, "Listing API resources failed: " + listing.getError());
        }

        List<ResourceSchema> schemas = new ArrayList<>();
        for (JsonNode entry : listing.getData()) {
            ResourceSchema schema = toSchema(entry);
            if (resources == null || resources.isEmpty() || resources.contains(schema.qualifiedName())) {
                schemas.add(schema);
            }
        }
        log.info("Capability scan: {} resources to index", schemas.size());

        List<String> indexed = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (ResourceSchema schema : schemas) {
            try {
                schema.setSchemaText(explain(schema, context));
                index.index(schema);
                indexed.add(schema.qualifiedName());
            } catch (AgentException e) {
                log.warn("Indexing {} failed: {}", schema.qualifiedName(), e.getMessage());
                failed.put(schema.qualifiedName(), e.getMessage());
            }
        }
        log.info("Capability scan finished: {} indexed, {} failed", indexed.size(), failed.size());
        return new ScanReport(schemas.size(), indexed, failed);
    }

    private String explain(ResourceSchema schema, ToolContext context) {
        ToolInvocation explained = gateway.invoke("kubectl_explain",
                Map.of("resource", schema.qualifiedName()), READ_ONLY, context, toolTimeout());
        return explained.isSuccess() ? explained.getOutput() : null;
    }

    private static ResourceSchema toSchema(JsonNode entry) {
        List<String> verbs = new ArrayList<>();
        entry.path("verbs").forEach(verb -> verbs.add(verb.asText()));
        return ResourceSchema.builder()
                .kind(entry.path("kind").asText())
                .group(entry.path("group").asText(""))
                .version(entry.path("version").asText())
                .plural(entry.path("name").asText())
                .namespaced(entry.path("namespaced").asBoolean())
                .verbs(verbs)
                .build();
    }

    private Duration toolTimeout() {
        return Duration.ofSeconds(properties.getWorkflow().getToolTimeoutSeconds());
    }
}
