package com.example.clusteragent.capability;

public enum MatchType {
    SEMANTIC,
    KEYWORD,
    HYBRID
}
