package com.al.shopsync.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Data
@Document(collection = "sync_runs")
@CompoundIndex(def = "{'entityType': 1, 'startedAt': -1}", name = "entity_started_idx")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SyncRunRecord {
    @Id
    private String id;

    @Indexed(unique = true)
    private String jobId;

    private String entityType; // "articles", "customers", "orders"
    private String mode;
    private String state; // "COMPLETED", "ABORTED", "FAILED"
    private boolean selected; // explicit id list vs. sync-all

    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private Long durationMs;

    // Result summary
    private int totalCount;
    private int successful;
    private int failed;
    private String errorMessage;
}
