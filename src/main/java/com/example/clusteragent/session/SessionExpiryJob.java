package com.example.clusteragent.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SessionExpiryJob {

    private final SessionEngine sessionEngine;

    @Scheduled(fixedDelayString = "${cluster-agent.sessions.prune-interval-ms:300000}",
            initialDelayString = "${cluster-agent.sessions.prune-interval-ms:300000}")
    public void prune() {
        log.debug("Pruning expired sessions");
        sessionEngine.pruneExpired();
    }
}
