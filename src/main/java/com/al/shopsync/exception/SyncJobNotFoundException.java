package com.al.shopsync.exception;

public class SyncJobNotFoundException extends RuntimeException {
    public SyncJobNotFoundException(String jobId) {
        super("Sync job not found: " + jobId);
    }
}
