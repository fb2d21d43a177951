package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.dto.RouteBoard;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Result of finalizing a visit. Exactly one of committed, blocked or retry needed.
 */
@Getter
@ToString
public class FinalizeOutcome {

    public enum Status {
        COMMITTED,
        BLOCKED,
        RETRY_NEEDED
    }

    private final Status status;
    private final List<String> reasons;
    // backend sync warnings, verbatim
    private final boolean syncWarnings;
    private final RouteBoard route;

    private FinalizeOutcome(Status status, List<String> reasons, boolean syncWarnings, RouteBoard route) {
        this.status = status;
        this.reasons = List.copyOf(reasons);
        this.syncWarnings = syncWarnings;
        this.route = route;
    }

    public static FinalizeOutcome committed(RouteBoard route) {
        return new FinalizeOutcome(Status.COMMITTED, List.of(), false, route);
    }

    public static FinalizeOutcome blocked(List<String> reasons) {
        return new FinalizeOutcome(Status.BLOCKED, reasons, false, null);
    }

    public static FinalizeOutcome syncBlocked(List<String> warnings) {
        return new FinalizeOutcome(Status.BLOCKED, warnings, true, null);
    }

    public static FinalizeOutcome retryNeeded(String reason) {
        return new FinalizeOutcome(Status.RETRY_NEEDED, List.of(reason), false, null);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }
}
