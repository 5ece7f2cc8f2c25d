package com.example.clusteragent.repository;

import com.example.clusteragent.domain.SessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SessionRecordRepository extends JpaRepository<SessionRecord, String> {

    List<SessionRecord> findAllByOrderByCreatedAtDesc();

    @Query("SELECT s.id FROM SessionRecord s WHERE s.expiresAt < :now")
    List<String> findExpiredIds(@Param("now") Instant now);
}
