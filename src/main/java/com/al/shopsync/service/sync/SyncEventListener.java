package com.al.shopsync.service.sync;

import com.al.shopsync.model.SyncEvent;

/**
 * Receives progress and terminal events of sync jobs.
 */
@FunctionalInterface
public interface SyncEventListener {

    SyncEventListener NONE = event -> {
    };

    void onEvent(SyncEvent event);
}
