package com.al.shopsync.controller;

import com.al.shopsync.dto.SyncAggregate;
import com.al.shopsync.dto.SyncAllRequest;
import com.al.shopsync.dto.SyncJobStatus;
import com.al.shopsync.dto.SyncRequest;
import com.al.shopsync.model.SyncRunRecord;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.service.AuditService;
import com.al.shopsync.service.SyncJobService;
import com.al.shopsync.service.sync.SyncJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sync")
@Tag(name = "Sync")
@Slf4j
public class SyncController {

    private final SyncJobService syncJobService;
    private final AuditService auditService;

    @Autowired
    public SyncController(SyncJobService syncJobService, AuditService auditService) {
        this.syncJobService = syncJobService;
        this.auditService = auditService;
    }

    @PostMapping("/{entityType}")
    @Operation(summary = "Sync selected source records and wait for the result")
    public ResponseEntity<SyncAggregate> syncSelected(@PathVariable EntityType entityType,
            @Valid @RequestBody SyncRequest request) {
        log.info("Received sync request for {} {} (mode {})", request.getIds().size(), entityType.getValue(),
                request.getMode().getValue());
        return ResponseEntity.ok(syncJobService.syncSelected(entityType, request.getIds(), request.getMapping(),
                request.getMode()));
    }

    @PostMapping("/{entityType}/all")
    @Operation(summary = "Start a background job syncing every source record")
    public ResponseEntity<SyncJobStatus> syncAll(@PathVariable EntityType entityType,
            @Valid @RequestBody(required = false) SyncAllRequest request) {
        SyncAllRequest effective = request == null ? new SyncAllRequest() : request;
        SyncJob job = syncJobService.startSyncAll(entityType, effective.getMapping(), effective.getMode());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SyncJobStatus.from(job));
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<SyncJobStatus>> listJobs() {
        return ResponseEntity.ok(syncJobService.listJobs().stream()
                .map(SyncJobStatus::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<SyncJobStatus> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(SyncJobStatus.from(syncJobService.getJob(jobId)));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    @Operation(summary = "Request cancellation; takes effect before the next batch")
    public ResponseEntity<SyncJobStatus> cancelJob(@PathVariable String jobId) {
        return ResponseEntity.ok(SyncJobStatus.from(syncJobService.cancel(jobId)));
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Map<String, String>> removeJob(@PathVariable String jobId) {
        syncJobService.remove(jobId);
        return ResponseEntity.ok(Map.of("message", "Sync job " + jobId + " removed"));
    }

    @GetMapping("/runs")
    @Operation(summary = "Recent sync runs, newest first")
    public ResponseEntity<List<SyncRunRecord>> recentRuns(@RequestParam(required = false) String entity) {
        return ResponseEntity.ok(auditService.recentRuns(entity));
    }
}
