package com.example.clusteragent.embedding;

import com.example.clusteragent.config.AgentProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Vector store on a Qdrant server, through its REST API. The collection is created on
 * first write with the configured embedding dimensions and cosine distance.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cluster-agent.vector-store", name = "type", havingValue = "qdrant")
public class QdrantVectorStore implements VectorStore {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AgentProperties properties;
    private final String collection;
    private final AtomicBoolean collectionReady = new AtomicBoolean(false);

    public QdrantVectorStore(WebClient webClient, ObjectMapper objectMapper, AgentProperties properties) {
        AgentProperties.VectorStoreConfig cfg = properties.getVectorStore();
        WebClient.Builder builder = webClient.mutate().baseUrl(cfg.getUrl());
        if (cfg.getApiKey() != null && !cfg.getApiKey().isBlank()) {
            builder.defaultHeader("api-key", cfg.getApiKey());
        }
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.collection = cfg.getCollection();
    }

    @Override
    public void upsert(String id, float[] vector, Map<String, Object> payload) {
        ensureCollection();
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode point = body.putArray("points").addObject();
        point.put("id", id);
        ArrayNode values = point.putArray("vector");
        for (float v : vector) {
            values.add(v);
        }
        point.set("payload", objectMapper.valueToTree(payload));
        call(HttpMethod.PUT, "/collections/" + collection + "/points?wait=true", body);
    }

    @Override
    public List<VectorHit> search(float[] vector, int limit) {
        if (!exists()) {
            return List.of();
        }
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode values = body.putArray("vector");
        for (float v : vector) {
            values.add(v);
        }
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("with_vector", true);
        JsonNode response = call(HttpMethod.POST, "/collections/" + collection + "/points/search", body);
        List<VectorHit> hits = new ArrayList<>();
        for (JsonNode point : response.path("result")) {
            hits.add(toHit(point, point.path("score").asDouble()));
        }
        return hits;
    }

    @Override
    public List<VectorHit> searchByKeywords(List<String> keywords, int limit) {
        if (keywords.isEmpty() || !exists()) {
            return List.of();
        }
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode should = body.putObject("filter").putArray("should");
        for (String keyword : keywords) {
            ObjectNode condition = should.addObject();
            condition.put("key", "searchText");
            condition.putObject("match").put("text", keyword);
        }
        body.put("limit", limit * 5);
        body.put("with_payload", true);
        body.put("with_vector", true);
        JsonNode response = call(HttpMethod.POST, "/collections/" + collection + "/points/scroll", body);
        List<VectorHit> hits = new ArrayList<>();
        for (JsonNode point : response.path("result").path("points")) {
            String text = point.path("payload").path("searchText").asText("");
            hits.add(toHit(point, Vectors.keywordScore(keywords, text)));
        }
        return hits.stream()
                .filter(hit -> hit.score() > 0)
                .sorted(Comparator.comparingDouble(VectorHit::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<VectorHit> get(String id) {
        try {
            JsonNode response = call(HttpMethod.GET, "/collections/" + collection + "/points/" + id, null);
            return Optional.of(toHit(response.path("result"), 0));
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public List<VectorHit> list(int limit) {
        if (!exists()) {
            return List.of();
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("with_vector", true);
        JsonNode response = call(HttpMethod.POST, "/collections/" + collection + "/points/scroll", body);
        List<VectorHit> hits = new ArrayList<>();
        for (JsonNode point : response.path("result").path("points")) {
            hits.add(toHit(point, 0));
        }
        return hits;
    }

    @Override
    public boolean delete(String id) {
        if (get(id).isEmpty()) {
            return false;
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("points").add(id);
        call(HttpMethod.POST, "/collections/" + collection + "/points/delete?wait=true", body);
        return true;
    }

    @Override
    public void deleteAll() {
        if (exists()) {
            call(HttpMethod.DELETE, "/collections/" + collection, null);
        }
        collectionReady.set(false);
        log.info("Qdrant collection '{}' dropped", collection);
    }

    @Override
    public long count() {
        if (!exists()) {
            return 0;
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("exact", true);
        return call(HttpMethod.POST, "/collections/" + collection + "/points/count", body)
                .path("result").path("count").asLong();
    }

    private boolean exists() {
        if (collectionReady.get()) {
            return true;
        }
        try {
            call(HttpMethod.GET, "/collections/" + collection, null);
            collectionReady.set(true);
            return true;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return false;
            }
            throw e;
        }
    }

    private void ensureCollection() {
        if (exists()) {
            return;
        }
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode vectors = body.putObject("vectors");
        vectors.put("size", properties.getLlm().getEmbedding().getDimensions());
        vectors.put("distance", "Cosine");
        call(HttpMethod.PUT, "/collections/" + collection, body);
        collectionReady.set(true);
        log.info("Created Qdrant collection '{}'", collection);
    }

    private JsonNode call(HttpMethod method, String uri, JsonNode body) {
        WebClient.RequestBodySpec request = webClient.method(method).uri(uri);
        WebClient.RequestHeadersSpec<?> spec = body != null
                ? request.contentType(MediaType.APPLICATION_JSON).bodyValue(body.toString())
                : request;
        String response = spec.retrieve().bodyToMono(String.class).block(TIMEOUT);
        return response == null ? objectMapper.createObjectNode() : readTree(response);
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Qdrant returned malformed JSON", e);
        }
    }

    private VectorHit toHit(JsonNode point, double score) {
        JsonNode vectorNode = point.path("vector");
        float[] vector = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            vector[i] = (float) vectorNode.get(i).asDouble();
        }
        Map<String, Object> payload = objectMapper.convertValue(point.path("payload"), PAYLOAD_TYPE);
        return new VectorHit(point.path("id").asText(), score, vector, payload);
    }
}
