package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Uses the position the device last reported through {@code /api/session/location}.
 */
@Component
@RequiredArgsConstructor
public class SessionLocationProvider implements LocationProvider {

    private final FieldExecutionProperties properties;

    @Override
    public CompletableFuture<GeoPoint> currentLocation(SessionContext session) {
        return CompletableFuture.completedFuture(
                session.recentLocation(properties.getLocation().getMaxAge()).orElse(GeoPoint.unknown()));
    }
}
