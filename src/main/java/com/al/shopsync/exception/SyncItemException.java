package com.al.shopsync.exception;

/**
 * Failure confined to a single record. The sync records it as a failed result
 * and moves on to the next record.
 */
public abstract class SyncItemException extends RuntimeException {

    protected SyncItemException(String message) {
        super(message);
    }

    protected SyncItemException(String message, Throwable cause) {
        super(message, cause);
    }
}
