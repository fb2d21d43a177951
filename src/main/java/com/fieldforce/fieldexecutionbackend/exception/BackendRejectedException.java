package com.fieldforce.fieldexecutionbackend.exception;

/**
 * The field backend refused the call and said why.
 */
public class BackendRejectedException extends FieldBackendException {

    private final int status;

    public BackendRejectedException(String method, int status, String message, Throwable cause) {
        super(method, message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
