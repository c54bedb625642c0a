package com.al.shopsync.client;

import com.al.shopsync.dto.ConnectionStatus;
import com.al.shopsync.model.FieldDescriptor;
import com.al.shopsync.model.MetafieldDefinition;
import com.al.shopsync.model.enums.EntityType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Write access to the system records are migrated to.
 */
public interface TargetSystemClient {

    ConnectionStatus testConnection();

    List<FieldDescriptor> getFields(EntityType entityType, String identifier);

    /**
     * @return id of the created record
     * @throws com.al.shopsync.exception.TargetWriteException if the target rejects the record
     */
    long create(EntityType entityType, JsonNode record);

    /**
     * @return id of the updated record
     */
    long update(EntityType entityType, long targetId, JsonNode record);

    /**
     * Looks a record up by its natural key (SKU, e-mail, order name). The
     * returned node carries at least a numeric {@code id}.
     *
     * @return empty when no record has the key
     * @throws com.al.shopsync.exception.TransportException if the lookup could not be performed
     */
    Optional<JsonNode> findByNaturalKey(EntityType entityType, String key);

    /**
     * Custom field definitions of {@code entityType}; empty when the entity has none.
     */
    List<MetafieldDefinition> getMetafieldDefinitions(EntityType entityType);

    /**
     * Declared type per {@code namespace.key}, cached. Empty when the
     * definitions cannot be loaded.
     */
    Map<String, String> getMetafieldTypes(EntityType entityType);
}
