package com.al.shopsync.service.sync;

import com.al.shopsync.dto.SyncAggregate;
import com.al.shopsync.model.SyncEvent;
import com.al.shopsync.model.SyncResult;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncEventType;
import com.al.shopsync.model.enums.SyncJobState;
import com.al.shopsync.model.enums.SyncMode;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one sync run: {@code IDLE -> RUNNING -> COMPLETED | ABORTED | FAILED}.
 *
 * <p>
 * Only the thread running the job changes its state; any thread may read it or
 * request cancellation.
 */
public class SyncJob {

    @Getter
    private final String jobId;
    @Getter
    private final EntityType entityType;
    @Getter
    private final SyncMode mode;
    /** true for an explicit id list, false for sync-all. */
    @Getter
    private final boolean selected;

    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final SyncAggregate aggregate = SyncAggregate.empty();

    private volatile SyncJobState state = SyncJobState.IDLE;
    private volatile int processedCount;
    private volatile int totalCount;
    private volatile String message;
    private volatile String error;
    private volatile RuntimeException failure;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime finishedAt;

    public SyncJob(String jobId, EntityType entityType, SyncMode mode, boolean selected) {
        this.jobId = jobId;
        this.entityType = entityType;
        this.mode = mode;
        this.selected = selected;
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    synchronized void start() {
        if (state != SyncJobState.IDLE) {
            throw new IllegalStateException("Sync job " + jobId + " already started (" + state + ")");
        }
        state = SyncJobState.RUNNING;
        startedAt = LocalDateTime.now();
    }

    void setTotalCount(int totalCount) {
        this.totalCount = totalCount;
    }

    synchronized void appendBatch(List<SyncResult> results, int processedIds) {
        aggregate.append(results);
        processedCount += processedIds;
    }

    synchronized void complete(String message) {
        finish(SyncJobState.COMPLETED);
        this.message = message;
    }

    synchronized void abort() {
        finish(SyncJobState.ABORTED);
        this.message = "Sync aborted after " + processedCount + " of " + totalCount + " record(s)";
    }

    synchronized void fail(RuntimeException cause) {
        finish(SyncJobState.FAILED);
        this.failure = cause;
        this.error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private void finish(SyncJobState terminal) {
        finishedAt = LocalDateTime.now();
        state = terminal;
    }

    /** A copy of the results so far. */
    public synchronized SyncAggregate getAggregate() {
        return aggregate.copy();
    }

    public SyncJobState getState() {
        return state;
    }

    public boolean isFinished() {
        return state.isTerminal();
    }

    public int getProcessedCount() {
        return processedCount;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public String getMessage() {
        return message;
    }

    public String getError() {
        return error;
    }

    /** The exception that failed the job, if any. */
    public RuntimeException getFailure() {
        return failure;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    synchronized SyncEvent toEvent(SyncEventType type) {
        return SyncEvent.builder()
                .event(type)
                .jobId(jobId)
                .entityType(entityType)
                .processedCount(processedCount)
                .totalCount(totalCount)
                .successful(aggregate.getSuccessful())
                .failed(aggregate.getFailed())
                .message(message)
                .error(error)
                .timestamp(Instant.now())
                .build();
    }
}
