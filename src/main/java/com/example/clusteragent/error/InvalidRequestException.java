package com.example.clusteragent.error;

/**
 * Rejected caller input (unknown solution id, missing required answer, action not
 * valid in the current phase). The session is left exactly as it was.
 */
public class InvalidRequestException extends AgentException {

    public InvalidRequestException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
