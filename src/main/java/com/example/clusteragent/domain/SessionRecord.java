package com.example.clusteragent.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted workflow session. Kind, phase and timestamps are columns so sessions can
 * be listed and pruned without parsing; history and context live in the JSON payload.
 */
@Entity
@Table(name = "sessions", indexes = {
        @Index(name = "idx_session_expires", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 32)
    private String kind;

    @Column(nullable = false, length = 32)
    private String phase;

    @Column(name = "payload", columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
