package com.al.shopsync.exception;

import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncMode;
import lombok.Getter;

@Getter
public class UnsupportedSyncModeException extends RuntimeException {

    private final EntityType entityType;
    private final SyncMode mode;

    public UnsupportedSyncModeException(EntityType entityType, SyncMode mode) {
        super("Sync mode '" + mode.getValue() + "' is not supported for " + entityType.getValue()
                + " (supported: " + entityType.getSupportedModes().stream().map(SyncMode::getValue).toList() + ")");
        this.entityType = entityType;
        this.mode = mode;
    }
}
