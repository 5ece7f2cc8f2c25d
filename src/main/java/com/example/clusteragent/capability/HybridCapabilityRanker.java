package com.example.clusteragent.capability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default ranking: semantic similarity weighted 0.7; keyword-only matches weighted 0.6;
 * a record found both ways keeps the better of its semantic score and keyword score
 * weighted 0.8.
 */
@Slf4j
@Component
public class HybridCapabilityRanker implements CapabilityRanker {

    static final double SEMANTIC_WEIGHT = 0.7;
    static final double KEYWORD_WEIGHT = 0.6;
    static final double HYBRID_KEYWORD_WEIGHT = 0.8;

    @Override
    public List<ScoredCapability> rank(List<String> keywords, List<ScoredCapability> semanticMatches,
                                       List<ScoredCapability> keywordMatches, double scoreThreshold) {
        Map<String, ScoredCapability> combined = new LinkedHashMap<>();
        for (ScoredCapability match : semanticMatches) {
            combined.put(match.record().getId(), match.withScore(match.score() * SEMANTIC_WEIGHT, MatchType.SEMANTIC));
        }
        for (ScoredCapability match : keywordMatches) {
            ScoredCapability existing = combined.get(match.record().getId());
            if (existing != null) {
                double score = Math.max(existing.score(), match.score() * HYBRID_KEYWORD_WEIGHT);
                combined.put(match.record().getId(), existing.withScore(score, MatchType.HYBRID));
            } else {
                combined.put(match.record().getId(), match.withScore(match.score() * KEYWORD_WEIGHT, MatchType.KEYWORD));
            }
        }
        List<ScoredCapability> ranked = combined.values().stream()
                .filter(match -> match.score() >= scoreThreshold)
                .sorted(Comparator.comparingDouble(ScoredCapability::score).reversed())
                .toList();
        log.debug("Ranked {} semantic and {} keyword candidates into {} results",
                semanticMatches.size(), keywordMatches.size(), ranked.size());
        return ranked;
    }
}
