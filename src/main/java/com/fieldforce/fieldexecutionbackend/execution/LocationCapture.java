package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort location for check-in and arrival. Never fails and never waits longer than the
 * configured timeout; anything short of a fix is recorded as the unknown 0/0 reading.
 */
@Slf4j
@Component
public class LocationCapture {

    private final LocationProvider provider;
    private final Duration timeout;

    public LocationCapture(LocationProvider provider, FieldExecutionProperties properties) {
        this.provider = provider;
        this.timeout = properties.getLocation().getCaptureTimeout();
    }

    /**
     * Uses the coordinates sent with the request when both are present, otherwise asks the
     * provider.
     */
    public GeoPoint resolve(SessionContext session, Double latitude, Double longitude) {
        if (latitude != null && longitude != null) {
            return new GeoPoint(latitude, longitude);
        }
        return capture(session);
    }

    public GeoPoint capture(SessionContext session) {
        CompletableFuture<GeoPoint> request;
        try {
            request = provider.currentLocation(session);
        } catch (RuntimeException e) {
            log.warn("Location provider failed for agent {}: {}", session.getAgentId(), e.getMessage());
            return GeoPoint.unknown();
        }
        if (request == null) {
            return GeoPoint.unknown();
        }

        GeoPoint location = request
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("No location fix for agent {} ({}), recording unknown",
                            session.getAgentId(), e.getClass().getSimpleName());
                    return GeoPoint.unknown();
                })
                .join();
        return location != null ? location : GeoPoint.unknown();
    }
}
