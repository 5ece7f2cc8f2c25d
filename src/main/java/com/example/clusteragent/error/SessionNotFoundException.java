package com.example.clusteragent.error;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends AgentException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.NOT_FOUND, "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }
}
