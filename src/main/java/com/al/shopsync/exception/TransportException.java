package com.al.shopsync.exception;

import lombok.Getter;

/**
 * A remote system could not be reached, refused the credentials or answered
 * with a server error. Raised for a single record it fails that record only;
 * it aborts the sync operation when listing fails or every record of a call
 * hits it.
 */
@Getter
public class TransportException extends RuntimeException {

    private final String system;

    public TransportException(String system, String message) {
        super(message);
        this.system = system;
    }

    public TransportException(String system, String message, Throwable cause) {
        super(message, cause);
        this.system = system;
    }
}
