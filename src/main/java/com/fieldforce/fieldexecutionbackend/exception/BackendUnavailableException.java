package com.fieldforce.fieldexecutionbackend.exception;

/**
 * Transient: I/O failure or a gateway status. The call may be retried by the user.
 */
public class BackendUnavailableException extends FieldBackendException {

    public BackendUnavailableException(String method, String message, Throwable cause) {
        super(method, message, cause);
    }
}
