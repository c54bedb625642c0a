package com.al.shopsync.service;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.dto.MappingValidationResult;
import com.al.shopsync.dto.SyncAggregate;
import com.al.shopsync.exception.MappingValidationException;
import com.al.shopsync.exception.SyncJobNotFoundException;
import com.al.shopsync.exception.SyncJobRejectedException;
import com.al.shopsync.exception.UnsupportedSyncModeException;
import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncJobState;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.service.sync.BatchSyncRunner;
import com.al.shopsync.service.sync.SyncEventListener;
import com.al.shopsync.service.sync.SyncJob;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Entry point for sync runs: validates the request, resolves the mapping to
 * use, runs selected syncs in the caller's thread and sync-all jobs in the
 * background, and keeps sync-all jobs around for polling and cancellation.
 *
 * <p>
 * Finished jobs are dropped once they are older than
 * {@code shop-sync.sync.job-retention}, or when more than
 * {@code shop-sync.sync.max-retained-jobs} of them are kept. Running jobs are
 * never dropped.
 */
@Service
@Slf4j
public class SyncJobService {

    private static final String MDC_JOB_KEY = "jobId";

    private final BatchSyncRunner runner;
    private final MappingConfigService mappingConfigService;
    private final MappingValidationService validationService;
    private final SyncEventListener eventListener;
    private final AuditService auditService;
    private final Executor jobExecutor;
    private final Duration jobRetention;
    private final int maxRetainedJobs;

    private final Map<String, SyncJob> jobs = new ConcurrentHashMap<>();

    public SyncJobService(BatchSyncRunner runner, MappingConfigService mappingConfigService,
            MappingValidationService validationService, SyncEventListener eventListener, AuditService auditService,
            @Qualifier("syncJobExecutor") Executor jobExecutor, ShopSyncProperties properties) {
        this.runner = runner;
        this.mappingConfigService = mappingConfigService;
        this.validationService = validationService;
        this.eventListener = eventListener;
        this.auditService = auditService;
        this.jobExecutor = jobExecutor;
        this.jobRetention = properties.getSync().getJobRetention();
        this.maxRetainedJobs = Math.max(0, properties.getSync().getMaxRetainedJobs());
    }

    /**
     * Syncs the given source ids and waits for the result.
     *
     * @param mappings mapping to apply, or null/empty for the stored one
     */
    public SyncAggregate syncSelected(EntityType entityType, List<String> sourceIds, List<FieldMapping> mappings,
            SyncMode mode) {
        List<FieldMapping> effective = prepare(entityType, mappings, mode);
        SyncJob job = new SyncJob(UUID.randomUUID().toString(), entityType, mode, true);
        MDC.put(MDC_JOB_KEY, job.getJobId());
        try {
            runner.runSelected(job, sourceIds, effective, eventListener);
        } finally {
            MDC.remove(MDC_JOB_KEY);
        }
        auditService.logRun(job);
        if (job.getState() == SyncJobState.FAILED && job.getFailure() != null) {
            throw job.getFailure();
        }
        return job.getAggregate();
    }

    /**
     * Starts a background job syncing every source record of {@code entityType}.
     *
     * @throws SyncJobRejectedException if the job executor has no room for it
     */
    public SyncJob startSyncAll(EntityType entityType, List<FieldMapping> mappings, SyncMode mode) {
        List<FieldMapping> effective = prepare(entityType, mappings, mode);
        evictFinishedJobs();
        SyncJob job = new SyncJob(UUID.randomUUID().toString(), entityType, mode, false);
        jobs.put(job.getJobId(), job);
        log.info("Starting sync-all job {} for {} (mode {})", job.getJobId(), entityType.getValue(),
                mode.getValue());
        try {
            jobExecutor.execute(() -> {
                MDC.put(MDC_JOB_KEY, job.getJobId());
                try {
                    runner.runAll(job, effective, eventListener);
                    auditService.logRun(job);
                } finally {
                    MDC.remove(MDC_JOB_KEY);
                }
            });
        } catch (RejectedExecutionException e) {
            jobs.remove(job.getJobId());
            log.warn("Sync-all job {} for {} rejected: {}", job.getJobId(), entityType.getValue(), e.getMessage());
            throw new SyncJobRejectedException("Too many sync-all jobs queued; try again later", e);
        }
        return job;
    }

    public SyncJob getJob(String jobId) {
        evictFinishedJobs();
        SyncJob job = jobs.get(jobId);
        if (job == null) {
            throw new SyncJobNotFoundException(jobId);
        }
        return job;
    }

    public Collection<SyncJob> listJobs() {
        evictFinishedJobs();
        return new ArrayList<>(jobs.values());
    }

    public SyncJob cancel(String jobId) {
        SyncJob job = getJob(jobId);
        if (!job.isFinished()) {
            job.requestCancel();
            log.info("Cancellation requested for sync job {}", jobId);
        }
        return job;
    }

    /**
     * Forgets a finished job.
     *
     * @throws IllegalStateException if the job is still running
     */
    public void remove(String jobId) {
        SyncJob job = getJob(jobId);
        if (!job.isFinished()) {
            throw new IllegalStateException("Sync job " + jobId + " is still " + job.getState());
        }
        jobs.remove(jobId);
    }

    void evictFinishedJobs() {
        LocalDateTime cutoff = LocalDateTime.now().minus(jobRetention);
        List<SyncJob> finished = jobs.values().stream()
                .filter(job -> job.isFinished() && job.getFinishedAt() != null)
                .sorted(Comparator.comparing(SyncJob::getFinishedAt).reversed())
                .collect(Collectors.toList());
        for (int i = 0; i < finished.size(); i++) {
            SyncJob job = finished.get(i);
            if (i >= maxRetainedJobs || !job.getFinishedAt().isAfter(cutoff)) {
                jobs.remove(job.getJobId());
                log.debug("Evicted finished sync job {}", job.getJobId());
            }
        }
    }

    private List<FieldMapping> prepare(EntityType entityType, List<FieldMapping> mappings, SyncMode mode) {
        if (!entityType.supports(mode)) {
            throw new UnsupportedSyncModeException(entityType, mode);
        }
        List<FieldMapping> effective = mappings == null || mappings.isEmpty()
                ? mappingConfigService.load(entityType)
                : mappings;
        MappingValidationResult validation = validationService.validate(entityType, effective, mode);
        if (!validation.isValid()) {
            throw new MappingValidationException("Mapping for " + entityType.getValue() + " is not valid for mode "
                    + mode.getValue(), validation.getErrors());
        }
        return List.copyOf(effective);
    }
}
