package com.example.clusteragent.capability;

public record ScoredCapability(CapabilityRecord record, double score, MatchType matchType) {

    public ScoredCapability withScore(double newScore, MatchType newType) {
        return new ScoredCapability(record, newScore, newType);
    }
}
