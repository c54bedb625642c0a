package com.al.shopsync.exception;

import lombok.Getter;

/**
 * The target system rejected a create or update (validation error, read-only
 * resource and so on).
 */
@Getter
public class TargetWriteException extends SyncItemException {

    private final int statusCode;

    public TargetWriteException(String message) {
        this(message, 0, null);
    }

    public TargetWriteException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
