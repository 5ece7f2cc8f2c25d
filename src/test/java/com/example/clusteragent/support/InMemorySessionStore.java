package com.example.clusteragent.support;

import com.example.clusteragent.config.AppConfig;
import com.example.clusteragent.session.Session;
import com.example.clusteragent.session.SessionStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store that keeps sessions as JSON, like the database-backed one, so every
 * read returns a fresh copy and anything that does not survive serialization shows up.
 */
public class InMemorySessionStore implements SessionStore {

    private final ObjectMapper mapper = new AppConfig().objectMapper();
    private final Map<String, String> sessions = new ConcurrentHashMap<>();
    private int saves;

    @Override
    public synchronized void save(Session session) {
        try {
            sessions.put(session.getId(), mapper.writeValueAsString(session));
            saves++;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session " + session.getId() + " is not serializable", e);
        }
    }

    @Override
    public Optional<Session> find(String id) {
        String json = sessions.get(id);
        return json == null ? Optional.empty() : Optional.of(read(json));
    }

    @Override
    public boolean delete(String id) {
        return sessions.remove(id) != null;
    }

    @Override
    public List<Session> findAll() {
        return sessions.values().stream()
                .map(this::read)
                .sorted(Comparator.comparing(Session::getCreatedAt).reversed())
                .toList();
    }

    @Override
    public List<String> findExpiredIds(Instant now) {
        return findAll().stream().filter(s -> s.isExpiredAt(now)).map(Session::getId).toList();
    }

    public synchronized int getSaves() {
        return saves;
    }

    private Session read(String json) {
        try {
            return mapper.readValue(json, Session.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored session is not readable", e);
        }
    }
}
