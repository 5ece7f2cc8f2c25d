package com.example.clusteragent.session;

import com.example.clusteragent.domain.SessionRecord;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.repository.SessionRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Session store on the JPA database; the whole aggregate is serialized into one row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final SessionRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public void save(Session session) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw AgentException.internal("Failed to serialize session " + session.getId(), e);
        }
        repository.save(SessionRecord.builder()
                .id(session.getId())
                .kind(session.getKind().name())
                .phase(session.getPhase().name())
                .payload(payload)
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt() != null ? session.getUpdatedAt() : Instant.now())
                .expiresAt(session.getExpiresAt())
                .build());
    }

    @Override
    public Optional<Session> find(String id) {
        return repository.findById(id).map(this::toSession);
    }

    @Override
    public boolean delete(String id) {
        if (!repository.existsById(id)) {
            return false;
        }
        repository.deleteById(id);
        return true;
    }

    @Override
    public List<Session> findAll() {
        List<Session> sessions = new ArrayList<>();
        for (SessionRecord record : repository.findAllByOrderByCreatedAtDesc()) {
            sessions.add(toSession(record));
        }
        return sessions;
    }

    @Override
    public List<String> findExpiredIds(Instant now) {
        return repository.findExpiredIds(now);
    }

    private Session toSession(SessionRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), Session.class);
        } catch (JsonProcessingException e) {
            throw AgentException.internal("Stored session " + record.getId() + " is unreadable", e);
        }
    }
}
