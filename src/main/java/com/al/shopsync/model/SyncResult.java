package com.al.shopsync.model;

import com.al.shopsync.model.enums.SyncStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable outcome of syncing one source record.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SyncResult {
    String sourceId;
    SyncStatus status;
    boolean success;
    Long targetId;
    String error;

    public static SyncResult created(String sourceId, long targetId) {
        return SyncResult.builder().sourceId(sourceId).status(SyncStatus.CREATED).success(true)
                .targetId(targetId).build();
    }

    public static SyncResult updated(String sourceId, long targetId) {
        return SyncResult.builder().sourceId(sourceId).status(SyncStatus.UPDATED).success(true)
                .targetId(targetId).build();
    }

    public static SyncResult matched(String sourceId, long targetId) {
        return SyncResult.builder().sourceId(sourceId).status(SyncStatus.MATCHED).success(true)
                .targetId(targetId).build();
    }

    public static SyncResult skipped(String sourceId, String reason) {
        return SyncResult.builder().sourceId(sourceId).status(SyncStatus.SKIPPED).success(false)
                .error(reason).build();
    }

    public static SyncResult failed(String sourceId, String error) {
        return SyncResult.builder().sourceId(sourceId).status(SyncStatus.ERROR).success(false)
                .error(error).build();
    }
}
