package com.example.clusteragent.repository;

import com.example.clusteragent.domain.VectorRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface VectorRecordRepository extends JpaRepository<VectorRecord, VectorRecord.Key> {

    List<VectorRecord> findByCollection(String collection);

    @Modifying
    @Transactional
    long deleteByCollection(String collection);
}
