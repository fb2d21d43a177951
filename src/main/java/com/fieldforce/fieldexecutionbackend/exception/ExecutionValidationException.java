package com.fieldforce.fieldexecutionbackend.exception;

import java.util.List;

/**
 * A requested transition is not legal in the current state. Raised before any network call.
 */
public class ExecutionValidationException extends RuntimeException {

    private final List<String> reasons;

    public ExecutionValidationException(String message) {
        this(message, List.of(message));
    }

    public ExecutionValidationException(String message, List<String> reasons) {
        super(message);
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
