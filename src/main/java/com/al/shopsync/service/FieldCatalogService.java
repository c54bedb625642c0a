package com.al.shopsync.service;

import com.al.shopsync.client.SourceSystemClient;
import com.al.shopsync.client.TargetSystemClient;
import com.al.shopsync.model.FieldDescriptor;
import com.al.shopsync.model.RequiredField;
import com.al.shopsync.model.enums.EntityType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Field catalogs of both shops, cached because enumerating them costs several
 * API calls.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FieldCatalogService {

    private final SourceSystemClient sourceClient;
    private final TargetSystemClient targetClient;

    @Cacheable(cacheNames = "fieldCatalog", key = "'source:' + #entityType.value + ':' + (#identifier ?: '*')")
    public List<FieldDescriptor> sourceFields(EntityType entityType, String identifier) {
        log.info("Enumerating Shopware 5 fields of {} (identifier {})", entityType.getValue(), identifier);
        return new ArrayList<>(sourceClient.getFields(entityType, identifier));
    }

    /**
     * Target fields, with the fields Shopify requires flagged and added when no
     * sample record carried them.
     */
    @Cacheable(cacheNames = "fieldCatalog", key = "'target:' + #entityType.value + ':' + (#identifier ?: '*')")
    public List<FieldDescriptor> targetFields(EntityType entityType, String identifier) {
        log.info("Enumerating Shopify fields of {} (identifier {})", entityType.getValue(), identifier);
        List<FieldDescriptor> fields = new ArrayList<>(targetClient.getFields(entityType, identifier));
        List<String> requiredPaths = entityType.getRequiredFields().stream()
                .map(RequiredField::getPath)
                .collect(Collectors.toList());
        for (FieldDescriptor field : fields) {
            if (requiredPaths.contains(field.getPath())) {
                field.setRequired(true);
            }
        }
        for (String path : requiredPaths) {
            boolean present = fields.stream().anyMatch(field -> path.equals(field.getPath()));
            if (!present) {
                fields.add(FieldDescriptor.builder()
                        .path(path)
                        .type("string")
                        .required(true)
                        .description("Required by Shopify")
                        .build());
            }
        }
        return fields;
    }
}
