package com.example.clusteragent.session;

public enum ExecutionMode {
    MANUAL,
    AUTOMATIC
}
