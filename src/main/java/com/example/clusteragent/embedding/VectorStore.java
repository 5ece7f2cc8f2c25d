package com.example.clusteragent.embedding;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Vector storage collaborator. Every call may fail transiently; callers retry.
 */
public interface VectorStore {

    void upsert(String id, float[] vector, Map<String, Object> payload);

    /**
     * Nearest points by cosine similarity, best first.
     */
    List<VectorHit> search(float[] vector, int limit);

    /**
     * Points whose {@code searchText} payload contains any of the keywords, scored by
     * the fraction of keywords found, best first.
     */
    List<VectorHit> searchByKeywords(List<String> keywords, int limit);

    Optional<VectorHit> get(String id);

    List<VectorHit> list(int limit);

    boolean delete(String id);

    void deleteAll();

    long count();
}
