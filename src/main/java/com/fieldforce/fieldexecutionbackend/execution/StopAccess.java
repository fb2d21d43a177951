package com.fieldforce.fieldexecutionbackend.execution;

public enum StopAccess {
    LOCKED,
    ELIGIBLE,
    ACTIVE,
    // completed or skipped stop of a running route: viewable, not transitionable
    READ_ONLY
}
