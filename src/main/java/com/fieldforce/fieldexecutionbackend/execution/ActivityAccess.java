package com.fieldforce.fieldexecutionbackend.execution;

public enum ActivityAccess {
    LOCKED,
    CURRENT,
    // completed or skipped; completed ones may still be amended
    DONE,
    READ_ONLY
}
