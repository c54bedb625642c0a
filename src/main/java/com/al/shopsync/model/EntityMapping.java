package com.al.shopsync.model;

import com.al.shopsync.model.enums.EntityType;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored mapping set of one entity type. The document id is the entity type
 * value so there is at most one document per type.
 */
@Data
@Document(collection = "entity_mappings")
public class EntityMapping {
    @Id
    private String id;

    private EntityType entityType;

    private List<FieldMapping> mappings = new ArrayList<>();

    private LocalDateTime updatedAt;
}
