package com.al.shopsync.service;

import com.al.shopsync.dto.SyncAggregate;
import com.al.shopsync.model.SyncRunRecord;
import com.al.shopsync.repository.SyncRunRepository;
import com.al.shopsync.service.sync.SyncJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private static final int RECENT_RUNS_LIMIT = 50;

    private final SyncRunRepository syncRunRepository;

    public AuditService(SyncRunRepository syncRunRepository) {
        this.syncRunRepository = syncRunRepository;
    }

    @Async
    public void logRun(SyncJob job) {
        try {
            SyncAggregate aggregate = job.getAggregate();
            SyncRunRecord record = new SyncRunRecord();
            record.setJobId(job.getJobId());
            record.setEntityType(job.getEntityType().getValue());
            record.setMode(job.getMode().getValue());
            record.setState(job.getState().name());
            record.setSelected(job.isSelected());
            record.setStartedAt(job.getStartedAt());
            record.setFinishedAt(job.getFinishedAt());
            if (job.getStartedAt() != null && job.getFinishedAt() != null) {
                record.setDurationMs(Duration.between(job.getStartedAt(), job.getFinishedAt()).toMillis());
            }
            record.setTotalCount(job.getTotalCount());
            record.setSuccessful(aggregate.getSuccessful());
            record.setFailed(aggregate.getFailed());
            record.setErrorMessage(job.getError());
            syncRunRepository.save(record);
        } catch (Exception e) {
            log.error("Failed to save sync run log for job {}: {}", job.getJobId(), e.getMessage(), e);
        }
    }

    public List<SyncRunRecord> recentRuns(String entityType) {
        PageRequest page = PageRequest.of(0, RECENT_RUNS_LIMIT);
        if (entityType == null || entityType.isBlank()) {
            return syncRunRepository.findAllByOrderByStartedAtDesc(page);
        }
        return syncRunRepository.findByEntityTypeOrderByStartedAtDesc(entityType, page);
    }
}
