package com.versemind.models.backend;

/**
 * Non-success HTTP response from the backend.
 */
public class BackendException extends RuntimeException {

    private final int statusCode;

    public BackendException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
