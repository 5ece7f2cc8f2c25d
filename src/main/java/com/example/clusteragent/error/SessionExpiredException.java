package com.example.clusteragent.error;

import lombok.Getter;

import java.time.Instant;

@Getter
public class SessionExpiredException extends AgentException {

    private final String sessionId;
    private final Instant expiredAt;

    public SessionExpiredException(String sessionId, Instant expiredAt) {
        super(ErrorKind.EXPIRED, "Session " + sessionId + " expired at " + expiredAt);
        this.sessionId = sessionId;
        this.expiredAt = expiredAt;
    }
}
