package com.chatrelay.autoreply.backend;

/**
 * Failure talking to the reply backend: transport error, timeout, non-2xx
 * status or unreadable body.
 */
public class BackendCallException extends RuntimeException {

    /** HTTP status, or 0 when no response was received. */
    private final int statusCode;

    public BackendCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public BackendCallException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
