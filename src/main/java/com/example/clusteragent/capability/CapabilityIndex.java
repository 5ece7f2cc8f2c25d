package com.example.clusteragent.capability;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.embedding.EmbeddingService;
import com.example.clusteragent.embedding.VectorHit;
import com.example.clusteragent.embedding.VectorStore;
import com.example.clusteragent.embedding.Vectors;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.retry.FailureClassifier;
import com.example.clusteragent.retry.RetryExecutor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Semantic index of the cluster's resource types.
 * <p>
 * Records are stored in the vector store under their deterministic id, so indexing the
 * same resource again replaces the earlier record. Store and embedding calls are retried
 * on transient failures; malformed schemas are rejected up front.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapabilityIndex {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final CapabilityRanker ranker;
    private final CapabilityInference inference;
    private final RetryExecutor retryExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    public CapabilityRecord index(ResourceSchema schema) {
        validate(schema);
        CapabilityRecord record = inference.infer(schema);
        float[] vector = embeddingService.embed(record.searchText());
        record.setEmbedding(vector);

        Map<String, Object> payload = objectMapper.convertValue(record, PAYLOAD_TYPE);
        payload.put("searchText", record.searchText());
        withRetry("vector upsert", () -> {
            vectorStore.upsert(record.getId(), vector, payload);
            return null;
        });
        log.info("Indexed capability {} ({})", record.getResourceName(), record.getId());
        return record;
    }

    /**
     * Ranked matches for a free-text intent, best first.
     */
    public List<ScoredCapability> search(String query, CapabilitySearchFilters filters) {
        if (query == null || query.isBlank()) {
            throw AgentException.validation("Search query must not be empty");
        }
        CapabilitySearchFilters effective = filters != null ? filters : CapabilitySearchFilters.none();
        int limit = effective.getLimit() != null ? effective.getLimit() : properties.getCapabilities().getSearchLimit();
        double threshold = effective.getScoreThreshold() != null
                ? effective.getScoreThreshold() : properties.getCapabilities().getScoreThreshold();
        int candidates = limit * 2;

        float[] queryVector = embeddingService.embed(query);
        List<String> keywords = Vectors.keywords(query);
        List<ScoredCapability> semantic = withRetry("vector search",
                () -> vectorStore.search(queryVector, candidates)).stream()
                .map(hit -> new ScoredCapability(toRecord(hit), hit.score(), MatchType.SEMANTIC))
                .toList();
        List<ScoredCapability> keyword = withRetry("keyword search",
                () -> vectorStore.searchByKeywords(keywords, candidates)).stream()
                .map(hit -> new ScoredCapability(toRecord(hit), hit.score(), MatchType.KEYWORD))
                .toList();

        List<ScoredCapability> results = ranker.rank(keywords, semantic, keyword, threshold).stream()
                .filter(match -> effective.matches(match.record()))
                .limit(limit)
                .toList();
        log.debug("Capability search '{}' returned {} results", query, results.size());
        return results;
    }

    public Optional<CapabilityRecord> get(String id) {
        return withRetry("vector get", () -> vectorStore.get(id)).map(this::toRecord);
    }

    public Optional<CapabilityRecord> getByName(String qualifiedName) {
        return get(CapabilityIds.forResource(qualifiedName));
    }

    public List<CapabilityRecord> list(int limit) {
        return withRetry("vector list", () -> vectorStore.list(limit)).stream()
                .map(this::toRecord)
                .toList();
    }

    public boolean delete(String id) {
        boolean deleted = withRetry("vector delete", () -> vectorStore.delete(id));
        if (deleted) {
            log.info("Deleted capability {}", id);
        }
        return deleted;
    }

    public boolean deleteByName(String qualifiedName) {
        return delete(CapabilityIds.forResource(qualifiedName));
    }

    public void deleteAll() {
        withRetry("vector delete all", () -> {
            vectorStore.deleteAll();
            return null;
        });
        log.info("Deleted all capabilities");
    }

    public long count() {
        return withRetry("vector count", vectorStore::count);
    }

    private CapabilityRecord toRecord(VectorHit hit) {
        CapabilityRecord record = objectMapper.convertValue(hit.payload(), CapabilityRecord.class);
        record.setEmbedding(hit.vector());
        return record;
    }

    private static void validate(ResourceSchema schema) {
        if (schema == null) {
            throw AgentException.validation("Resource schema is required");
        }
        if (isBlank(schema.getKind()) || isBlank(schema.getPlural()) || isBlank(schema.getVersion())) {
            throw AgentException.validation("Resource schema needs kind, plural and version: " + schema);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private <T> T withRetry(String operation, Callable<T> call) {
        AgentProperties.RetryConfig retry = properties.getRetry();
        return retryExecutor.withRetry(operation, call, FailureClassifier::isTransient,
                retry.getRetryCount(), retry.toBackoff());
    }
}
