package com.example.clusteragent.service;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.domain.AuditLog;
import com.example.clusteragent.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of tool executions and session transitions. Writes run asynchronously
 * on the agent pool so callers never wait on the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final AgentProperties properties;

    @Async("agentExecutor")
    public void log(String actor, String action, String target, Map<String, Object> details,
                    String sessionId, boolean success) {
        if (!properties.getAudit().isEnabled()) {
            return;
        }
        String detailsJson = null;
        if (details != null) {
            try {
                detailsJson = objectMapper.writeValueAsString(details);
            } catch (JsonProcessingException e) {
                log.warn("Audit details for {} on {} not serializable: {}", action, target, e.getMessage());
                detailsJson = String.valueOf(details);
            }
        }
        try {
            auditLogRepository.save(AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .target(target)
                    .details(truncate(detailsJson, 8000))
                    .sessionId(sessionId)
                    .success(success)
                    .timestamp(Instant.now())
                    .build());
            log.debug("Audit: [{}] {} -> {} ({})", actor, action, target, success ? "OK" : "FAIL");
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry {} for session {}", action, sessionId, e);
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, limit)).getContent();
    }

    public List<AuditLog> getBySession(String sessionId) {
        return auditLogRepository.findBySessionIdOrderByTimestampAsc(sessionId);
    }

    public long countByAction(String action) {
        return auditLogRepository.countByAction(action);
    }

    private static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }
}
