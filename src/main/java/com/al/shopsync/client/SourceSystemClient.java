package com.al.shopsync.client;

import com.al.shopsync.dto.ConnectionStatus;
import com.al.shopsync.dto.EntityPage;
import com.al.shopsync.model.FieldDescriptor;
import com.al.shopsync.model.enums.EntityType;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Read access to the system records are migrated from.
 */
public interface SourceSystemClient {

    ConnectionStatus testConnection();

    /**
     * One page of records. {@code limit == 0} only reports the total.
     */
    EntityPage listIds(EntityType entityType, int limit, int offset);

    /**
     * @throws com.al.shopsync.exception.NotFoundException  if the record does not exist
     * @throws com.al.shopsync.exception.TransportException if the source cannot be reached
     */
    JsonNode getById(EntityType entityType, String id);

    /**
     * Field paths of one record (when {@code identifier} is given) or of a sample
     * of records.
     */
    List<FieldDescriptor> getFields(EntityType entityType, String identifier);
}
