package com.al.shopsync.service;

import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.exception.MappingValidationException;
import com.al.shopsync.exception.VersionMismatchException;
import com.al.shopsync.model.EntityMapping;
import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.MappingExportBundle;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.repository.EntityMappingRepository;
import com.al.shopsync.service.path.FieldPath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists one mapping set per entity type and moves all of them in and out
 * as a versioned bundle.
 */
@Service
@Slf4j
public class MappingConfigService {

    /** Order of entity types inside an export bundle. */
    private static final List<EntityType> EXPORT_ORDER = List.of(EntityType.ARTICLES, EntityType.ORDERS,
            EntityType.CUSTOMERS);

    private final EntityMappingRepository repository;
    private final MappingValidationService validationService;
    private final String exportVersion;

    public MappingConfigService(EntityMappingRepository repository, MappingValidationService validationService,
            ShopSyncProperties properties) {
        this.repository = repository;
        this.validationService = validationService;
        this.exportVersion = properties.getMapping().getExportVersion();
    }

    public List<FieldMapping> load(EntityType entityType) {
        return repository.findById(entityType.getValue())
                .map(EntityMapping::getMappings)
                .orElseGet(List::of);
    }

    /**
     * Replaces the stored mapping set of {@code entityType}.
     *
     * @throws MappingValidationException if a (source, target) pair occurs twice
     * @throws com.al.shopsync.exception.InvalidPathException if a path does not parse
     */
    public List<FieldMapping> save(EntityType entityType, List<FieldMapping> mappings) {
        for (FieldMapping mapping : mappings) {
            FieldPath.parse(mapping.getSourceField());
            FieldPath.parse(mapping.getTargetField());
        }
        List<String> duplicates = validationService.findDuplicates(mappings);
        if (!duplicates.isEmpty()) {
            throw new MappingValidationException("Mapping for " + entityType.getValue() + " contains duplicates",
                    duplicates);
        }
        EntityMapping document = new EntityMapping();
        document.setId(entityType.getValue());
        document.setEntityType(entityType);
        document.setMappings(new ArrayList<>(mappings));
        document.setUpdatedAt(LocalDateTime.now());
        repository.save(document);
        log.info("Saved {} mapping(s) for {}", mappings.size(), entityType.getValue());
        return document.getMappings();
    }

    public void clear(EntityType entityType) {
        repository.deleteById(entityType.getValue());
        log.info("Cleared mappings for {}", entityType.getValue());
    }

    public MappingExportBundle exportAll() {
        Map<String, List<FieldMapping>> mappings = new LinkedHashMap<>();
        for (EntityType entityType : EXPORT_ORDER) {
            mappings.put(entityType.getValue(), load(entityType));
        }
        return new MappingExportBundle(exportVersion, Instant.now().toString(), mappings);
    }

    /**
     * Imports every entity type present in the bundle. Nothing is written when
     * the version differs or any set contains duplicates.
     *
     * @return number of mappings imported per entity type
     */
    public Map<String, Integer> importAll(MappingExportBundle bundle) {
        if (bundle == null || !exportVersion.equals(bundle.getVersion())) {
            throw new VersionMismatchException(bundle == null ? null : bundle.getVersion(), exportVersion);
        }
        Map<String, List<FieldMapping>> incoming = bundle.getMappings() == null ? Map.of() : bundle.getMappings();

        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, List<FieldMapping>> entry : incoming.entrySet()) {
            EntityType.fromValue(entry.getKey());
            if (entry.getValue() != null) {
                validationService.findDuplicates(entry.getValue())
                        .forEach(error -> errors.add(entry.getKey() + ": " + error));
            }
        }
        if (!errors.isEmpty()) {
            throw new MappingValidationException("Imported bundle contains duplicate mappings", errors);
        }

        Map<String, Integer> imported = new LinkedHashMap<>();
        for (EntityType entityType : EXPORT_ORDER) {
            List<FieldMapping> mappings = incoming.get(entityType.getValue());
            if (mappings == null) {
                continue;
            }
            save(entityType, mappings);
            imported.put(entityType.getValue(), mappings.size());
        }
        log.info("Imported mapping bundle exported at {}: {}", bundle.getExportDate(), imported);
        return imported;
    }
}
