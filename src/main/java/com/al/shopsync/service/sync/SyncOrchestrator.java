package com.al.shopsync.service.sync;

import com.al.shopsync.client.SourceSystemClient;
import com.al.shopsync.client.TargetSystemClient;
import com.al.shopsync.dto.PreviewResponse;
import com.al.shopsync.dto.SyncAggregate;
import com.al.shopsync.exception.SyncItemException;
import com.al.shopsync.exception.TransportException;
import com.al.shopsync.exception.UnsupportedSyncModeException;
import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.SyncResult;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.service.MappingApplier;
import com.al.shopsync.service.MappingValidationService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Syncs source records into the target: fetch, project, validate, match and
 * write, one record at a time or a list of records in parallel.
 *
 * <p>
 * Failures of a single record end up in that record's {@link SyncResult} and
 * the remaining records are still processed. This includes a
 * {@link TransportException} raised for one record. Only when every record of
 * a {@link #syncMany} call fails on transport are the shops considered
 * unreachable, and the first such exception is rethrown to the caller.
 *
 * @author Shop Sync Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class SyncOrchestrator {

    private final SourceSystemClient sourceClient;
    private final TargetSystemClient targetClient;
    private final MappingApplier mappingApplier;
    private final MappingValidationService validationService;
    private final TargetMatcher targetMatcher;
    private final MeterRegistry meterRegistry;
    private final Executor itemExecutor;

    public SyncOrchestrator(SourceSystemClient sourceClient, TargetSystemClient targetClient,
            MappingApplier mappingApplier, MappingValidationService validationService, TargetMatcher targetMatcher,
            MeterRegistry meterRegistry, @Qualifier("syncItemExecutor") Executor itemExecutor) {
        this.sourceClient = sourceClient;
        this.targetClient = targetClient;
        this.mappingApplier = mappingApplier;
        this.validationService = validationService;
        this.targetMatcher = targetMatcher;
        this.meterRegistry = meterRegistry;
        this.itemExecutor = itemExecutor;
    }

    /**
     * Fetches one source record and shows what the mapping makes of it, without
     * touching the target.
     */
    public PreviewResponse preview(EntityType entityType, String sourceId, List<FieldMapping> mappings) {
        JsonNode source = sourceClient.getById(entityType, sourceId);
        ObjectNode mapped = mappingApplier.project(source, mappings, metafieldTypes(entityType, mappings));
        return new PreviewResponse(source, mapped, mappings.size());
    }

    public SyncAggregate syncMany(EntityType entityType, List<String> sourceIds, List<FieldMapping> mappings,
            SyncMode mode) {
        return syncMany(entityType, sourceIds, mappings, mode, new SyncContext());
    }

    /**
     * Syncs {@code sourceIds} concurrently. Results are in input order.
     *
     * @throws UnsupportedSyncModeException before any record is touched
     * @throws TransportException           when every record failed on transport
     */
    public SyncAggregate syncMany(EntityType entityType, List<String> sourceIds, List<FieldMapping> mappings,
            SyncMode mode, SyncContext context) {
        requireSupported(entityType, mode);
        List<FieldMapping> snapshot = List.copyOf(mappings);
        Map<String, String> metafieldTypes = metafieldTypes(entityType, snapshot);

        long startTime = System.currentTimeMillis();
        log.info("Syncing {} {} (mode {})", sourceIds.size(), entityType.getValue(), mode.getValue());

        List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>();
        for (String sourceId : sourceIds) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> attempt(entityType, sourceId, snapshot, metafieldTypes, context, mode), itemExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        List<SyncResult> results = new ArrayList<>();
        TransportException firstTransportFailure = null;
        int transportFailures = 0;
        for (CompletableFuture<ItemOutcome> future : futures) {
            ItemOutcome outcome = future.join();
            results.add(outcome.getResult());
            if (outcome.getTransportFailure() != null) {
                transportFailures++;
                if (firstTransportFailure == null) {
                    firstTransportFailure = outcome.getTransportFailure();
                }
            }
        }
        if (!results.isEmpty() && transportFailures == results.size()) {
            log.error("All {} {} failed on transport, giving up: {}", results.size(), entityType.getValue(),
                    firstTransportFailure.getMessage());
            throw firstTransportFailure;
        }
        SyncAggregate aggregate = SyncAggregate.of(results);

        log.info("Synced {} {}: {} successful, {} failed, {}ms total", aggregate.getTotal(), entityType.getValue(),
                aggregate.getSuccessful(), aggregate.getFailed(), System.currentTimeMillis() - startTime);
        return aggregate;
    }

    public SyncResult syncOne(EntityType entityType, String sourceId, List<FieldMapping> mappings, SyncMode mode,
            SyncContext context) {
        requireSupported(entityType, mode);
        return attempt(entityType, sourceId, mappings, metafieldTypes(entityType, mappings), context, mode)
                .getResult();
    }

    private ItemOutcome attempt(EntityType entityType, String sourceId, List<FieldMapping> mappings,
            Map<String, String> metafieldTypes, SyncContext context, SyncMode mode) {
        Timer.Sample sample = Timer.start(meterRegistry);
        SyncResult result;
        TransportException transportFailure = null;
        try {
            result = process(entityType, sourceId, mappings, metafieldTypes, mode, context);
        } catch (TransportException e) {
            log.warn("{} {} failed on transport: {}", entityType.getSourceLabel(), sourceId, e.getMessage());
            transportFailure = e;
            result = SyncResult.failed(sourceId, e.getMessage());
        } catch (SyncItemException e) {
            log.warn("{} {} failed: {}", entityType.getSourceLabel(), sourceId, e.getMessage());
            result = SyncResult.failed(sourceId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error syncing {} {}: {}", entityType.getSourceLabel(), sourceId, e.getMessage(), e);
            result = SyncResult.failed(sourceId,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            sample.stop(meterRegistry.timer("shopsync.item.duration", "entity", entityType.getValue()));
        }
        countItem(entityType, result.getStatus().getValue());
        return new ItemOutcome(result, transportFailure);
    }

    private SyncResult process(EntityType entityType, String sourceId, List<FieldMapping> mappings,
            Map<String, String> metafieldTypes, SyncMode mode, SyncContext context) {
        JsonNode source = sourceClient.getById(entityType, sourceId);
        ObjectNode mapped = mappingApplier.project(source, mappings, metafieldTypes);
        validationService.validateRecord(entityType, mapped, mode);

        MatchDecision decision = targetMatcher.resolveTarget(entityType, sourceId, source, mapped, mode, context);
        switch (decision.getAction()) {
            case CREATE: {
                long targetId = targetClient.create(entityType, mapped);
                context.recordLink(sourceId, targetId);
                return SyncResult.created(sourceId, targetId);
            }
            case UPDATE: {
                long targetId = targetClient.update(entityType, decision.getTargetId(), mapped);
                context.recordLink(sourceId, targetId);
                return SyncResult.updated(sourceId, targetId);
            }
            default: {
                if (decision.getError() != null) {
                    log.info("{} {} skipped: {}", entityType.getSourceLabel(), sourceId, decision.getError());
                    return SyncResult.skipped(sourceId, decision.getError());
                }
                context.recordLink(sourceId, decision.getTargetId());
                return SyncResult.matched(sourceId, decision.getTargetId());
            }
        }
    }

    /** Declared metafield types, looked up only when some mapping writes a metafield. */
    private Map<String, String> metafieldTypes(EntityType entityType, List<FieldMapping> mappings) {
        boolean targetsMetafields = mappings.stream()
                .map(FieldMapping::getTargetField)
                .anyMatch(target -> target != null
                        && (target.startsWith("metafields.") || target.startsWith("metafields[")));
        return targetsMetafields ? targetClient.getMetafieldTypes(entityType) : Map.of();
    }

    private void requireSupported(EntityType entityType, SyncMode mode) {
        if (!entityType.supports(mode)) {
            throw new UnsupportedSyncModeException(entityType, mode);
        }
    }

    private void countItem(EntityType entityType, String status) {
        meterRegistry.counter("shopsync.items", "entity", entityType.getValue(), "status", status).increment();
    }

    @Value
    private static class ItemOutcome {
        SyncResult result;
        TransportException transportFailure;
    }
}
