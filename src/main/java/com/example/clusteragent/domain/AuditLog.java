package com.example.clusteragent.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail entry for tool executions, tool denials and session phase transitions.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_session", columnList = "session_id"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** "agent", "user", "automatic", "system" */
    @Column(nullable = false)
    private String actor;

    /** TOOL_EXECUTED, TOOL_DENIED, SESSION_CREATED, PHASE_TRANSITION, APPROVAL_RECORDED, SESSION_FAILED, SESSION_DELETED */
    @Column(nullable = false)
    private String action;

    /** Tool name or session phase the entry is about */
    private String target;

    @Column(length = 8192)
    private String details;

    @Column(name = "session_id")
    private String sessionId;

    @Builder.Default
    private boolean success = true;

    @Column(nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
