package com.example.clusteragent.error;

/**
 * Failure taxonomy shared by every component of the agent.
 * Only {@link #TRANSIENT} failures are ever retried automatically.
 */
public enum ErrorKind {
    VALIDATION,
    PERMISSION,
    TRANSIENT,
    PRECONDITION,
    NOT_FOUND,
    EXPIRED,
    TIMEOUT,
    CONFLICT,
    INTERNAL;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
