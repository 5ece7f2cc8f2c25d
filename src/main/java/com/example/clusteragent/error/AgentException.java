package com.example.clusteragent.error;

import lombok.Getter;

/**
 * Base unchecked exception for agent failures. The {@link ErrorKind} tells callers
 * (and the REST layer) how the failure should be treated.
 */
@Getter
public class AgentException extends RuntimeException {

    private final ErrorKind kind;

    public AgentException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static AgentException validation(String message) {
        return new AgentException(ErrorKind.VALIDATION, message);
    }

    public static AgentException precondition(String message) {
        return new AgentException(ErrorKind.PRECONDITION, message);
    }

    public static AgentException transientFailure(String message, Throwable cause) {
        return new AgentException(ErrorKind.TRANSIENT, message, cause);
    }

    public static AgentException timeout(String message) {
        return new AgentException(ErrorKind.TIMEOUT, message);
    }

    public static AgentException conflict(String message) {
        return new AgentException(ErrorKind.CONFLICT, message);
    }

    public static AgentException internal(String message, Throwable cause) {
        return new AgentException(ErrorKind.INTERNAL, message, cause);
    }
}
