package com.al.shopsync.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portable snapshot of all stored mappings, keyed by entity type value
 * ({@code articles}, {@code orders}, {@code customers}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MappingExportBundle {
    private String version;
    private String exportDate;
    private Map<String, List<FieldMapping>> mappings = new LinkedHashMap<>();
}
