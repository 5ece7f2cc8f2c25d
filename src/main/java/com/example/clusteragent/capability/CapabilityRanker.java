package com.example.clusteragent.capability;

import java.util.List;

/**
 * Turns raw candidates into the ordered result of a capability search.
 * Implementations must return results sorted by descending score.
 */
public interface CapabilityRanker {

    /**
     * @param keywords          query keywords (see {@link com.example.clusteragent.embedding.Vectors#keywords})
     * @param semanticMatches   candidates scored by vector similarity
     * @param keywordMatches    candidates scored by keyword match ratio
     * @param scoreThreshold    results scoring below are dropped
     */
    List<ScoredCapability> rank(List<String> keywords, List<ScoredCapability> semanticMatches,
                                List<ScoredCapability> keywordMatches, double scoreThreshold);
}
