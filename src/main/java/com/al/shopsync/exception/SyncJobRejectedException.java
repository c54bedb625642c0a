package com.al.shopsync.exception;

/**
 * No capacity is left to queue another sync-all job.
 */
public class SyncJobRejectedException extends RuntimeException {
    public SyncJobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
