package com.al.shopsync.repository;

import com.al.shopsync.model.SyncRunRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncRunRepository extends MongoRepository<SyncRunRecord, String> {

    List<SyncRunRecord> findByEntityTypeOrderByStartedAtDesc(String entityType, Pageable pageable);

    List<SyncRunRecord> findAllByOrderByStartedAtDesc(Pageable pageable);

    Optional<SyncRunRecord> findByJobId(String jobId);
}
