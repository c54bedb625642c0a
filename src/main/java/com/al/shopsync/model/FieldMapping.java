package com.al.shopsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One source path to target path correspondence. A mapping without a
 * transformation copies the value unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FieldMapping {

    @NotBlank
    private String sourceField;

    @NotBlank
    private String targetField;

    private TransformationRule transformation;

    public static FieldMapping of(String sourceField, String targetField) {
        return new FieldMapping(sourceField, targetField, null);
    }

    public static FieldMapping of(String sourceField, String targetField, TransformationRule transformation) {
        return new FieldMapping(sourceField, targetField, transformation);
    }

    @JsonIgnore
    public TransformationRule effectiveTransformation() {
        return transformation == null ? TransformationRule.direct() : transformation;
    }

    @JsonIgnore
    public String pairKey() {
        return sourceField + " -> " + targetField;
    }
}
