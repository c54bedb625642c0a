package com.al.shopsync.service.sync;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State shared by the items of one sync invocation: the source id to target
 * id links established so far. A new context is created per invocation, so
 * nothing carries over between runs.
 */
public class SyncContext {

    private final Map<String, Long> targetIdsBySourceId = new ConcurrentHashMap<>();

    public void recordLink(String sourceId, long targetId) {
        targetIdsBySourceId.put(sourceId, targetId);
    }

    public Optional<Long> linkedTarget(String sourceId) {
        return Optional.ofNullable(targetIdsBySourceId.get(sourceId));
    }

    public int linkCount() {
        return targetIdsBySourceId.size();
    }
}
