package com.al.shopsync.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a mapping set has structural errors and cannot be saved or used
 * for a sync.
 */
@Getter
public class MappingValidationException extends RuntimeException {

    private final List<String> errors;

    public MappingValidationException(String message) {
        this(message, List.of(message));
    }

    public MappingValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }
}
