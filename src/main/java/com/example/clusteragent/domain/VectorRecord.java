package com.example.clusteragent.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted point of the in-memory vector store. The vector column stores a
 * comma-separated float array as TEXT; the payload is JSON.
 */
@Entity
@Table(name = "vector_records", indexes = {
        @Index(name = "idx_vector_collection", columnList = "collection")
})
@IdClass(VectorRecord.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorRecord {

    @Id
    @Column(nullable = false, length = 64)
    private String collection;

    @Id
    @Column(name = "point_id", nullable = false, length = 64)
    private String pointId;

    @Column(name = "vector", columnDefinition = "TEXT", nullable = false)
    private String vector;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String collection;
        private String pointId;
    }
}
