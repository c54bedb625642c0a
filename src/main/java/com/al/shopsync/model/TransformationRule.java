package com.al.shopsync.model;

import com.al.shopsync.model.enums.TransformationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-field transformation applied to a source value before it is written to
 * the target record. Only the options relevant to {@link #type} are read; the
 * others are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransformationRule {

    @Builder.Default
    private TransformationType type = TransformationType.DIRECT;

    /** Literal text ({@code replace}) or pattern ({@code regex}) to look for. */
    private String find;

    private String replace;

    private String splitDelimiter;

    private String joinDelimiter;

    /** Expression evaluated by {@code custom} rules, with the value bound as {@code #value}. */
    private String customCode;

    public static TransformationRule direct() {
        return TransformationRule.builder().type(TransformationType.DIRECT).build();
    }

    public TransformationType effectiveType() {
        return type == null ? TransformationType.DIRECT : type;
    }
}
