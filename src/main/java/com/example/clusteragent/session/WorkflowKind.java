package com.example.clusteragent.session;

public enum WorkflowKind {
    RECOMMENDATION("rec"),
    REMEDIATION("rem");

    private final String idPrefix;

    WorkflowKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public Phase initialPhase() {
        return this == RECOMMENDATION ? Phase.CLARIFYING : Phase.INVESTIGATING;
    }
}
