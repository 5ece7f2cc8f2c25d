package com.example.clusteragent.agent;

public enum InvocationOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    /** Refused before execution: permission, unknown tool or invalid arguments */
    REJECTED
}
