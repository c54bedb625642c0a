package com.al.shopsync.controller;

import com.al.shopsync.client.SourceSystemClient;
import com.al.shopsync.client.TargetSystemClient;
import com.al.shopsync.dto.ConnectionStatus;
import com.al.shopsync.dto.EntityPage;
import com.al.shopsync.exception.NotFoundException;
import com.al.shopsync.model.FieldDescriptor;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.service.FieldCatalogService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views of both shops: source records, field catalogs, target
 * lookups and connection checks.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Catalog")
@Slf4j
public class CatalogController {

    static final int MAX_PAGE_SIZE = 1000;

    private final SourceSystemClient sourceClient;
    private final TargetSystemClient targetClient;
    private final FieldCatalogService fieldCatalogService;

    @Autowired
    public CatalogController(SourceSystemClient sourceClient, TargetSystemClient targetClient,
            FieldCatalogService fieldCatalogService) {
        this.sourceClient = sourceClient;
        this.targetClient = targetClient;
        this.fieldCatalogService = fieldCatalogService;
    }

    @GetMapping("/connections")
    @Operation(summary = "Test the connections to both shops")
    public ResponseEntity<Map<String, ConnectionStatus>> testConnections() {
        Map<String, ConnectionStatus> result = new LinkedHashMap<>();
        result.put("source", sourceClient.testConnection());
        result.put("target", targetClient.testConnection());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/entities/{entityType}/source")
    public ResponseEntity<EntityPage> listSource(@PathVariable EntityType entityType,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return ResponseEntity.ok(sourceClient.listIds(entityType, limit, offset));
    }

    @GetMapping("/entities/{entityType}/source/fields")
    @Operation(summary = "Field paths found in source records")
    public ResponseEntity<Map<String, Object>> sourceFields(@PathVariable EntityType entityType,
            @RequestParam(required = false) String identifier) {
        List<FieldDescriptor> fields = fieldCatalogService.sourceFields(entityType, identifier);
        return ResponseEntity.ok(Map.of("fields", fields, "count", fields.size()));
    }

    @GetMapping("/entities/{entityType}/source/{id}")
    public ResponseEntity<JsonNode> getSource(@PathVariable EntityType entityType, @PathVariable String id) {
        return ResponseEntity.ok(sourceClient.getById(entityType, id));
    }

    @GetMapping("/entities/{entityType}/target/fields")
    @Operation(summary = "Field paths found in target records, required fields flagged")
    public ResponseEntity<Map<String, Object>> targetFields(@PathVariable EntityType entityType,
            @RequestParam(required = false) String identifier) {
        List<FieldDescriptor> fields = fieldCatalogService.targetFields(entityType, identifier);
        return ResponseEntity.ok(Map.of("fields", fields, "count", fields.size(),
                "read_only", entityType.isTargetReadOnly()));
    }

    @GetMapping("/entities/{entityType}/target/lookup")
    @Operation(summary = "Find a target record by natural key (SKU, e-mail, order name)")
    public ResponseEntity<JsonNode> lookupTarget(@PathVariable EntityType entityType, @RequestParam String key) {
        return ResponseEntity.ok(targetClient.findByNaturalKey(entityType, key)
                .orElseThrow(() -> new NotFoundException(entityType.getTargetLabel() + " with key '" + key
                        + "' not found in target")));
    }
}
