package com.al.shopsync.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MappingValidationResult {
    private boolean valid;
    private List<String> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();

    public static MappingValidationResult of(List<String> errors, List<String> warnings) {
        return new MappingValidationResult(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }
}
