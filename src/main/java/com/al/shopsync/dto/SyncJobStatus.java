package com.al.shopsync.dto;

import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncJobState;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.service.sync.SyncJob;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SyncJobStatus {
    private String jobId;
    private EntityType entityType;
    private SyncMode mode;
    private SyncJobState state;
    private int processedCount;
    private int totalCount;
    private boolean cancelRequested;
    private String message;
    private String error;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private SyncAggregate aggregate;

    public static SyncJobStatus from(SyncJob job) {
        return SyncJobStatus.builder()
                .jobId(job.getJobId())
                .entityType(job.getEntityType())
                .mode(job.getMode())
                .state(job.getState())
                .processedCount(job.getProcessedCount())
                .totalCount(job.getTotalCount())
                .cancelRequested(job.isCancelRequested())
                .message(job.getMessage())
                .error(job.getError())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .aggregate(job.getAggregate())
                .build();
    }
}
