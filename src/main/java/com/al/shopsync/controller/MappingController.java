package com.al.shopsync.controller;

import com.al.shopsync.dto.MappingValidationResult;
import com.al.shopsync.dto.PreviewRequest;
import com.al.shopsync.dto.PreviewResponse;
import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.MappingExportBundle;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.service.MappingConfigService;
import com.al.shopsync.service.MappingValidationService;
import com.al.shopsync.service.sync.SyncOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/mapping")
@Tag(name = "Mapping")
@Slf4j
public class MappingController {

    private final MappingConfigService mappingConfigService;
    private final MappingValidationService validationService;
    private final SyncOrchestrator syncOrchestrator;

    @Autowired
    public MappingController(MappingConfigService mappingConfigService, MappingValidationService validationService,
            SyncOrchestrator syncOrchestrator) {
        this.mappingConfigService = mappingConfigService;
        this.validationService = validationService;
        this.syncOrchestrator = syncOrchestrator;
    }

    @GetMapping("/export")
    @Operation(summary = "Export all stored mappings as a versioned bundle")
    public ResponseEntity<MappingExportBundle> exportMappings() {
        return ResponseEntity.ok(mappingConfigService.exportAll());
    }

    @PostMapping("/import")
    @Operation(summary = "Import a mapping bundle, replacing the mappings it contains")
    public ResponseEntity<Map<String, Object>> importMappings(@RequestBody MappingExportBundle bundle) {
        log.info("Received mapping bundle version {}", bundle.getVersion());
        Map<String, Integer> imported = mappingConfigService.importAll(bundle);
        return ResponseEntity.ok(Map.of("imported", imported));
    }

    @GetMapping("/{entityType}")
    public ResponseEntity<List<FieldMapping>> getMapping(@PathVariable EntityType entityType) {
        return ResponseEntity.ok(mappingConfigService.load(entityType));
    }

    @PutMapping("/{entityType}")
    public ResponseEntity<List<FieldMapping>> saveMapping(@PathVariable EntityType entityType,
            @RequestBody List<FieldMapping> mappings) {
        return ResponseEntity.ok(mappingConfigService.save(entityType, mappings));
    }

    @DeleteMapping("/{entityType}")
    public ResponseEntity<Map<String, String>> clearMapping(@PathVariable EntityType entityType) {
        mappingConfigService.clear(entityType);
        return ResponseEntity.ok(Map.of("message", "Mapping for " + entityType.getValue() + " cleared"));
    }

    /**
     * Applies a mapping (the stored one when the request carries none) to one
     * source record without writing anything.
     */
    @PostMapping("/{entityType}/preview")
    @Operation(summary = "Preview the mapped record for one source record")
    public ResponseEntity<PreviewResponse> preview(@PathVariable EntityType entityType,
            @Valid @RequestBody PreviewRequest request) {
        List<FieldMapping> mappings = request.getMapping() == null || request.getMapping().isEmpty()
                ? mappingConfigService.load(entityType)
                : request.getMapping();
        return ResponseEntity.ok(syncOrchestrator.preview(entityType, request.getSourceId(), mappings));
    }

    @PostMapping("/{entityType}/validate")
    @Operation(summary = "Check a mapping for errors and missing required target fields")
    public ResponseEntity<MappingValidationResult> validate(@PathVariable EntityType entityType,
            @RequestParam(defaultValue = "upsert") SyncMode mode,
            @RequestBody(required = false) List<FieldMapping> mappings) {
        List<FieldMapping> effective = mappings == null || mappings.isEmpty()
                ? mappingConfigService.load(entityType)
                : mappings;
        return ResponseEntity.ok(validationService.validate(entityType, effective, mode));
    }
}
