package com.al.shopsync.client;

import org.springframework.http.HttpStatusCode;

/**
 * Classifies HTTP error statuses of the shop APIs.
 */
final class RemoteStatus {

    private RemoteStatus() {
    }

    /**
     * Statuses that say nothing about the record itself: bad credentials,
     * throttling, timeouts and server errors.
     */
    static boolean isTransportFailure(HttpStatusCode status) {
        int code = status.value();
        return status.is5xxServerError() || code == 401 || code == 403 || code == 407 || code == 408
                || code == 429;
    }
}
