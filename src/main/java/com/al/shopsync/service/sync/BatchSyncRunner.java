package com.al.shopsync.service.sync;

import com.al.shopsync.client.SourceSystemClient;
import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.dto.EntityPage;
import com.al.shopsync.dto.SyncAggregate;
import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncEventType;
import com.al.shopsync.util.CollectionUtil;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a {@link SyncJob} through the orchestrator: a single call for a
 * selected id list, or a sync of every source record in fixed-size batches
 * with progress events and cancellation between batches.
 *
 * <p>
 * A running batch is never interrupted; a cancel request takes effect before
 * the next batch starts (or between listing pages while ids are collected).
 */
@Component
@Slf4j
public class BatchSyncRunner {

    private final SourceSystemClient sourceClient;
    private final SyncOrchestrator orchestrator;
    private final int listingPageSize;
    private final int batchSize;

    public BatchSyncRunner(SourceSystemClient sourceClient, SyncOrchestrator orchestrator,
            ShopSyncProperties properties) {
        this.sourceClient = sourceClient;
        this.orchestrator = orchestrator;
        this.listingPageSize = Math.max(1, properties.getSync().getListingPageSize());
        this.batchSize = Math.max(1, properties.getSync().getBatchSize());
    }

    public SyncJob runSelected(SyncJob job, List<String> sourceIds, List<FieldMapping> mappings,
            SyncEventListener listener) {
        job.start();
        job.setTotalCount(sourceIds.size());
        try {
            SyncAggregate aggregate = orchestrator.syncMany(job.getEntityType(), sourceIds, mappings, job.getMode());
            job.appendBatch(aggregate.getResults(), sourceIds.size());
            emit(job, SyncEventType.PROGRESS, listener);
            job.complete("Synced " + aggregate.getTotal() + " " + job.getEntityType().getValue() + ": "
                    + aggregate.getSuccessful() + " successful, " + aggregate.getFailed() + " failed");
            emit(job, SyncEventType.COMPLETED, listener);
        } catch (RuntimeException e) {
            log.error("Sync job {} failed: {}", job.getJobId(), e.getMessage());
            job.fail(e);
            emit(job, SyncEventType.FAILED, listener);
        }
        return job;
    }

    public SyncJob runAll(SyncJob job, List<FieldMapping> mappings, SyncEventListener listener) {
        job.start();
        EntityType entityType = job.getEntityType();
        try {
            long total = sourceClient.listIds(entityType, 0, 0).getTotal();
            if (total == 0) {
                job.complete("Nothing to sync: no " + entityType.getSourceLabel().toLowerCase() + " found in source");
                emit(job, SyncEventType.COMPLETED, listener);
                return job;
            }
            job.setTotalCount((int) total);

            List<String> ids = collectIds(job, total);
            if (ids == null) {
                job.abort();
                emit(job, SyncEventType.ABORTED, listener);
                return job;
            }
            job.setTotalCount(ids.size());

            List<List<String>> batches = CollectionUtil.partition(ids, batchSize);
            log.info("Sync job {}: {} {} in {} batch(es) of up to {}", job.getJobId(), ids.size(),
                    entityType.getValue(), batches.size(), batchSize);

            SyncContext context = new SyncContext();
            for (int i = 0; i < batches.size(); i++) {
                if (job.isCancelRequested()) {
                    log.info("Sync job {} cancelled before batch {}/{}", job.getJobId(), i + 1, batches.size());
                    job.abort();
                    emit(job, SyncEventType.ABORTED, listener);
                    return job;
                }
                List<String> batch = batches.get(i);
                SyncAggregate part = orchestrator.syncMany(entityType, batch, mappings, job.getMode(), context);
                job.appendBatch(part.getResults(), batch.size());
                log.debug("Sync job {}: batch {}/{} done, {}/{} processed", job.getJobId(), i + 1, batches.size(),
                        job.getProcessedCount(), job.getTotalCount());
                emit(job, SyncEventType.PROGRESS, listener);
            }

            SyncAggregate aggregate = job.getAggregate();
            job.complete("Synced " + aggregate.getTotal() + " " + entityType.getValue() + ": "
                    + aggregate.getSuccessful() + " successful, " + aggregate.getFailed() + " failed");
            emit(job, SyncEventType.COMPLETED, listener);
        } catch (RuntimeException e) {
            log.error("Sync job {} failed after {} record(s): {}", job.getJobId(), job.getProcessedCount(),
                    e.getMessage());
            job.fail(e);
            emit(job, SyncEventType.FAILED, listener);
        }
        return job;
    }

    /**
     * Pages through the source listing until {@code total} ids are collected or
     * a page comes back empty.
     *
     * @return the ids, or null when cancellation was requested meanwhile
     */
    private List<String> collectIds(SyncJob job, long total) {
        List<String> ids = new ArrayList<>();
        int offset = 0;
        while (ids.size() < total) {
            if (job.isCancelRequested()) {
                return null;
            }
            EntityPage page = sourceClient.listIds(job.getEntityType(), listingPageSize, offset);
            if (page.getData().isEmpty()) {
                break;
            }
            for (JsonNode row : page.getData()) {
                JsonNode id = row.path("id");
                if (!id.isMissingNode() && !id.isNull()) {
                    ids.add(id.asText());
                }
            }
            offset += listingPageSize;
        }
        return ids;
    }

    private void emit(SyncJob job, SyncEventType type, SyncEventListener listener) {
        try {
            listener.onEvent(job.toEvent(type));
        } catch (RuntimeException e) {
            log.warn("Sync event listener failed for job {}: {}", job.getJobId(), e.getMessage());
        }
    }
}
