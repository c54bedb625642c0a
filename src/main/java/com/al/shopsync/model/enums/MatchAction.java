package com.al.shopsync.model.enums;

public enum MatchAction {
    CREATE,
    UPDATE,
    SKIP
}
