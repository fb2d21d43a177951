package com.fieldforce.fieldexecutionbackend.exception;

/**
 * Unexpected failure talking to the field backend.
 */
public class FieldBackendException extends RuntimeException {

    private final String method;

    public FieldBackendException(String method, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
