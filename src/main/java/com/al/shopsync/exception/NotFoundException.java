package com.al.shopsync.exception;

public class NotFoundException extends SyncItemException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
