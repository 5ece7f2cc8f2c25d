package com.example.clusteragent.embedding;

import com.example.clusteragent.agent.ModelService;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.retry.FailureClassifier;
import com.example.clusteragent.retry.RetryExecutor;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;

/**
 * Embeds text through the model service. Results are cached in Caffeine keyed by the
 * SHA-256 of the text; transient model failures are retried with backoff.
 */
@Slf4j
@Service
public class EmbeddingService {

    private final ModelService modelService;
    private final RetryExecutor retryExecutor;
    private final AgentProperties properties;

    private final Cache<String, float[]> embeddingCache;

    public EmbeddingService(ModelService modelService, RetryExecutor retryExecutor, AgentProperties properties) {
        this.modelService = modelService;
        this.retryExecutor = retryExecutor;
        this.properties = properties;

        AgentProperties.LlmConfig.EmbeddingConfig cfg = properties.getLlm().getEmbedding();
        this.embeddingCache = Caffeine.newBuilder()
                .maximumSize(cfg.getCacheSize())
                .expireAfterWrite(cfg.getCacheTtlMinutes(), TimeUnit.MINUTES)
                .build();
    }

    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw AgentException.validation("Cannot embed empty text");
        }
        return embeddingCache.get(sha256(text), key -> callModel(text)).clone();
    }

    private float[] callModel(String text) {
        AgentProperties.RetryConfig retry = properties.getRetry();
        float[] vector = retryExecutor.withRetry("embedding", () -> modelService.embed(text),
                FailureClassifier::isTransient, retry.getRetryCount(), retry.toBackoff());
        log.debug("Embedded {} chars into {} dimensions", text.length(), vector.length);
        return vector;
    }

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
