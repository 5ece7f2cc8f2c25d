package com.example.clusteragent.capability;

import com.example.clusteragent.agent.AgentMessage;
import com.example.clusteragent.agent.ModelJson;
import com.example.clusteragent.agent.ModelResponse;
import com.example.clusteragent.agent.ModelService;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.retry.FailureClassifier;
import com.example.clusteragent.retry.RetryExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the semantic part of a capability record. Fields already present on the
 * schema are used as they are; otherwise the model is asked to describe the resource.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CapabilityInference {

    private static final int MAX_SCHEMA_CHARS = 6000;

    private final ModelService modelService;
    private final RetryExecutor retryExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    @Data
    public static class InferredCapability {
        private List<String> capabilities = new ArrayList<>();
        private List<String> providers = new ArrayList<>();
        private List<String> abstractions = new ArrayList<>();
        private Complexity complexity = Complexity.MEDIUM;
        private String description;
        private String useCase;
        private double confidence;
    }

    public CapabilityRecord infer(ResourceSchema schema) {
        CapabilityRecord.CapabilityRecordBuilder record = CapabilityRecord.builder()
                .id(CapabilityIds.forResource(schema.qualifiedName()))
                .resourceName(schema.qualifiedName())
                .kind(schema.getKind())
                .apiVersion(schema.apiVersion())
                .namespaced(schema.isNamespaced())
                .verbs(copy(schema.getVerbs()))
                .analyzedAt(Instant.now());

        if (schema.hasInferredFields()) {
            return record
                    .capabilities(copy(schema.getCapabilities()))
                    .providers(copy(schema.getProviders()))
                    .abstractions(copy(schema.getAbstractions()))
                    .complexity(schema.getComplexity() != null ? schema.getComplexity() : Complexity.MEDIUM)
                    .description(schema.getDescription())
                    .confidence(1.0)
                    .build();
        }

        InferredCapability inferred = askModel(schema);
        log.debug("Inferred capabilities of {}: {}", schema.qualifiedName(), inferred.getCapabilities());
        return record
                .capabilities(copy(inferred.getCapabilities()))
                .providers(copy(inferred.getProviders()))
                .abstractions(copy(inferred.getAbstractions()))
                .complexity(inferred.getComplexity() != null ? inferred.getComplexity() : Complexity.MEDIUM)
                .description(inferred.getDescription() != null ? inferred.getDescription() : schema.getDescription())
                .useCase(inferred.getUseCase())
                .confidence(inferred.getConfidence())
                .build();
    }

    private InferredCapability askModel(ResourceSchema schema) {
        List<AgentMessage> messages = List.of(
                AgentMessage.system("You analyze Kubernetes resource types and describe what they are for. "
                        + "Answer with a single JSON object and nothing else."),
                AgentMessage.user(prompt(schema)));
        AgentProperties.RetryConfig retry = properties.getRetry();
        ModelResponse response = retryExecutor.withRetry("capability inference",
                () -> modelService.sendMessage(messages, List.of()),
                FailureClassifier::isTransient, retry.getRetryCount(), retry.toBackoff());
        return ModelJson.parse(objectMapper, response.content(), InferredCapability.class);
    }

    private String prompt(ResourceSchema schema) {
        StringBuilder sb = new StringBuilder();
        sb.append("Resource: ").append(schema.qualifiedName()).append('\n');
        sb.append("Kind: ").append(schema.getKind()).append('\n');
        sb.append("API version: ").append(schema.apiVersion()).append('\n');
        sb.append("Namespaced: ").append(schema.isNamespaced()).append('\n');
        if (schema.getDescription() != null) {
            sb.append("Description: ").append(schema.getDescription()).append('\n');
        }
        if (schema.getSchemaText() != null) {
            String text = schema.getSchemaText();
            sb.append("Schema:\n").append(text.length() > MAX_SCHEMA_CHARS ? text.substring(0, MAX_SCHEMA_CHARS) : text)
                    .append('\n');
        }
        sb.append("""

                Return JSON with these fields:
                {
                  "capabilities": ["short functional tags, e.g. postgresql, database, backup"],
                  "providers": ["cloud or platform providers this resource targets, empty if none"],
                  "abstractions": ["higher level properties, e.g. high-availability, persistent-storage"],
                  "complexity": "low | medium | high",
                  "description": "one sentence on what the resource does",
                  "useCase": "one sentence on when to choose it",
                  "confidence": 0.0
                }
                """);
        return sb.toString();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
