package com.al.shopsync.exception;

public class InvalidPathException extends IllegalArgumentException {

    public InvalidPathException(String path, String reason) {
        super("Invalid field path '" + path + "': " + reason);
    }
}
