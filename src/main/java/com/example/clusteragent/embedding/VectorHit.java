package com.example.clusteragent.embedding;

import java.util.Map;

/**
 * A stored point returned by the vector store. {@code score} is the cosine similarity
 * for vector searches, the keyword match ratio for keyword searches and 0 for lookups.
 */
public record VectorHit(String id, double score, float[] vector, Map<String, Object> payload) {
}
