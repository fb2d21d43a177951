package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.exception.ExecutionValidationException;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import com.fieldforce.fieldexecutionbackend.model.Route;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Everything the engine knows about one agent's working session. Passed explicitly to every
 * engine operation.
 */
public class SessionContext {

    private final String agentId;

    private volatile Route route;
    private volatile GeoPoint lastKnownLocation;
    private volatile LocalDateTime lastLocationAt;

    private final Map<String, ActivitySequence> sequences = new ConcurrentHashMap<>();
    // Working copies, used when the progress store is unavailable
    private final Map<String, ProgressRecord> records = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public SessionContext(String agentId) {
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }

    public Route getRoute() {
        return route;
    }

    public void setRoute(Route route) {
        this.route = route;
    }

    public Optional<Route> currentRoute() {
        return Optional.ofNullable(route);
    }

    public void reportLocation(GeoPoint location) {
        this.lastKnownLocation = location;
        this.lastLocationAt = LocalDateTime.now();
    }

    /**
     * Last reported location if it is younger than {@code maxAge}.
     */
    public Optional<GeoPoint> recentLocation(Duration maxAge) {
        GeoPoint location = lastKnownLocation;
        LocalDateTime at = lastLocationAt;
        if (location == null || at == null || !location.isKnown()) {
            return Optional.empty();
        }
        if (at.plus(maxAge).isBefore(LocalDateTime.now())) {
            return Optional.empty();
        }
        return Optional.of(location);
    }

    public Optional<ActivitySequence> sequence(String visitId) {
        return Optional.ofNullable(sequences.get(visitId));
    }

    public void putSequence(ActivitySequence sequence) {
        sequences.put(sequence.getVisitId(), sequence);
    }

    public Optional<ProgressRecord> workingRecord(String unitId) {
        return Optional.ofNullable(records.get(unitId));
    }

    public void putWorkingRecord(ProgressRecord record) {
        records.put(record.getUnitId(), record);
    }

    /**
     * Drops everything held for a visit or transfer.
     */
    public void forget(String unitId) {
        sequences.remove(unitId);
        records.remove(unitId);
    }

    /**
     * Runs a mutating action while holding the identifier. A second mutation on the same
     * identifier while the first is still running is rejected.
     */
    public <T> T exclusive(String identifier, Supplier<T> action) {
        if (!inFlight.add(identifier)) {
            throw new ExecutionValidationException("Another action on " + identifier + " is still in progress");
        }
        try {
            return action.get();
        } finally {
            inFlight.remove(identifier);
        }
    }

    public boolean isBusy(String identifier) {
        return inFlight.contains(identifier);
    }
}
