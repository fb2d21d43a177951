package com.fieldforce.fieldexecutionbackend.exception;

public class UnknownSessionException extends RuntimeException {

    public UnknownSessionException(String message) {
        super(message);
    }
}
