package com.al.shopsync.model;

import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncEventType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Progress or terminal notification of a sync job.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SyncEvent {
    SyncEventType event;
    String jobId;
    EntityType entityType;
    int processedCount;
    int totalCount;
    int successful;
    int failed;
    String message;
    String error;
    Instant timestamp;

    public String routingKey() {
        return "sync." + entityType.getValue() + "." + event.getValue();
    }
}
