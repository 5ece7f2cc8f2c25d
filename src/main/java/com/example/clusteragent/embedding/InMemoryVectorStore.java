package com.example.clusteragent.embedding;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.domain.VectorRecord;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.repository.VectorRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index backed by the vector_records table.
 * <p>
 * On startup, loads the collection's persisted points into a {@link ConcurrentHashMap};
 * similarity is computed in pure Java, which is plenty for the few thousand resource
 * types a cluster serves. Writes go through to the database.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cluster-agent.vector-store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryVectorStore implements VectorStore {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final VectorRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final String collection;

    private final Map<String, VectorHit> index = new ConcurrentHashMap<>();

    public InMemoryVectorStore(VectorRecordRepository repository, ObjectMapper objectMapper,
                               AgentProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.collection = properties.getVectorStore().getCollection();
    }

    @PostConstruct
    public void loadFromDatabase() {
        List<VectorRecord> records = repository.findByCollection(collection);
        for (VectorRecord record : records) {
            try {
                Map<String, Object> payload = record.getPayload() != null
                        ? objectMapper.readValue(record.getPayload(), PAYLOAD_TYPE) : Map.of();
                index.put(record.getPointId(),
                        new VectorHit(record.getPointId(), 0, Vectors.parse(record.getVector()), payload));
            } catch (JsonProcessingException | NumberFormatException e) {
                log.warn("Skipping unreadable vector record {}: {}", record.getPointId(), e.getMessage());
            }
        }
        log.info("Vector store '{}' loaded {} points from DB", collection, index.size());
    }

    @Override
    public void upsert(String id, float[] vector, Map<String, Object> payload) {
        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw AgentException.validation("Payload of point " + id + " is not serializable: " + e.getOriginalMessage());
        }
        repository.save(VectorRecord.builder()
                .collection(collection)
                .pointId(id)
                .vector(Vectors.serialize(vector))
                .payload(payloadJson)
                .build());
        index.put(id, new VectorHit(id, 0, vector.clone(), new LinkedHashMap<>(payload)));
    }

    @Override
    public List<VectorHit> search(float[] vector, int limit) {
        return index.values().stream()
                .map(hit -> new VectorHit(hit.id(), Vectors.cosineSimilarity(vector, hit.vector()),
                        hit.vector(), hit.payload()))
                .sorted(Comparator.comparingDouble(VectorHit::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<VectorHit> searchByKeywords(List<String> keywords, int limit) {
        return index.values().stream()
                .map(hit -> new VectorHit(hit.id(),
                        Vectors.keywordScore(keywords, String.valueOf(hit.payload().getOrDefault("searchText", ""))),
                        hit.vector(), hit.payload()))
                .filter(hit -> hit.score() > 0)
                .sorted(Comparator.comparingDouble(VectorHit::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<VectorHit> get(String id) {
        return Optional.ofNullable(index.get(id));
    }

    @Override
    public List<VectorHit> list(int limit) {
        return index.values().stream()
                .sorted(Comparator.comparing(VectorHit::id))
                .limit(limit)
                .toList();
    }

    @Override
    public boolean delete(String id) {
        boolean existed = index.remove(id) != null;
        repository.deleteById(new VectorRecord.Key(collection, id));
        return existed;
    }

    @Override
    public void deleteAll() {
        index.clear();
        long removed = repository.deleteByCollection(collection);
        log.info("Vector store '{}' cleared ({} rows)", collection, removed);
    }

    @Override
    public long count() {
        return index.size();
    }
}
