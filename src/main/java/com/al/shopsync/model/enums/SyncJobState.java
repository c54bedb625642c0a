package com.al.shopsync.model.enums;

public enum SyncJobState {
    IDLE,
    RUNNING,
    COMPLETED,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == FAILED;
    }
}
