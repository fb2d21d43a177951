package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.model.GeoPoint;

import java.util.concurrent.CompletableFuture;

/**
 * Source of the agent's current position. May complete late, exceptionally, or never.
 */
public interface LocationProvider {

    CompletableFuture<GeoPoint> currentLocation(SessionContext session);
}
