package com.al.shopsync.exception;

import lombok.Getter;

@Getter
public class VersionMismatchException extends RuntimeException {

    private final String actualVersion;
    private final String expectedVersion;

    public VersionMismatchException(String actualVersion, String expectedVersion) {
        super("Incompatible export version: " + actualVersion + " (expected " + expectedVersion + ")");
        this.actualVersion = actualVersion;
        this.expectedVersion = expectedVersion;
    }
}
