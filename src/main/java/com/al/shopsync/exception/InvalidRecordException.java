package com.al.shopsync.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidRecordException extends SyncItemException {

    private final List<String> missingFields;

    public InvalidRecordException(List<String> missingFields) {
        super("Missing or empty required target fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }
}
