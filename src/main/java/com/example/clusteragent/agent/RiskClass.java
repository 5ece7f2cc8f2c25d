package com.example.clusteragent.agent;

/**
 * Risk classification of a tool; decides in which workflow phases it may run.
 */
public enum RiskClass {
    READ_ONLY,
    MUTATING
}
