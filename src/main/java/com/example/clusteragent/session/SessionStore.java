package com.example.clusteragent.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of sessions, keyed by session id.
 */
public interface SessionStore {

    void save(Session session);

    Optional<Session> find(String id);

    boolean delete(String id);

    /**
     * Newest first.
     */
    List<Session> findAll();

    List<String> findExpiredIds(Instant now);
}
