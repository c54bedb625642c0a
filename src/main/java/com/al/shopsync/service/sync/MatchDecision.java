package com.al.shopsync.service.sync;

import com.al.shopsync.model.enums.MatchAction;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What to do with one mapped record. A {@code SKIP} without error is a match
 * in a read-only target; a {@code SKIP} with error is a record that cannot be
 * synced in the requested mode.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MatchDecision {
    MatchAction action;
    Long targetId;
    String error;

    public static MatchDecision create() {
        return new MatchDecision(MatchAction.CREATE, null, null);
    }

    public static MatchDecision update(long targetId) {
        return new MatchDecision(MatchAction.UPDATE, targetId, null);
    }

    public static MatchDecision matched(long targetId) {
        return new MatchDecision(MatchAction.SKIP, targetId, null);
    }

    public static MatchDecision skip(String error) {
        return new MatchDecision(MatchAction.SKIP, null, error);
    }
}
