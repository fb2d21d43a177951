package com.fieldforce.fieldexecutionbackend.client;

import com.fieldforce.fieldexecutionbackend.dto.FinalizeResponse;
import com.fieldforce.fieldexecutionbackend.dto.ItemCheckUpdate;
import com.fieldforce.fieldexecutionbackend.dto.UnplannedStopRequest;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.Transfer;
import com.fieldforce.fieldexecutionbackend.model.Visit;
import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;

import java.util.List;
import java.util.Optional;

/**
 * Remote operations of the authoritative field backend. Every call is a blocking round-trip.
 * <p>
 * Failures surface as {@link com.fieldforce.fieldexecutionbackend.exception.BackendUnavailableException}
 * (transient), {@link com.fieldforce.fieldexecutionbackend.exception.BackendRejectedException}
 * (the backend said no) or {@link com.fieldforce.fieldexecutionbackend.exception.FieldBackendException}.
 */
public interface FieldBackendClient {

    // Routes

    Optional<Route> getTodaysRoute(String agentId);

    Route getRoute(String routeId);

    Route startRoute(String routeId, GeoPoint location);

    Route endRoute(String routeId, GeoPoint location, String notes);

    Route arriveAtStop(String routeId, int stopIdx, GeoPoint location);

    Route completeStop(String routeId, int stopIdx);

    Route skipStop(String routeId, int stopIdx, String reason);

    Route addUnplannedStop(String routeId, UnplannedStopRequest stop);

    // Visits

    Visit getVisit(String visitId);

    void markActivityCompleted(String visitId, String activityType, String activityName,
                               String status, ActivityResult result);

    List<MediaRef> getVisitMedia(String visitId);

    void attachVisitMedia(String visitId, List<MediaRef> media);

    FinalizeResponse finalizeVisit(String visitId);

    // Transfers

    Transfer getTransferDetail(String transferId);

    void startLoadingCheck(String transferId);

    void updateItemCheck(String transferId, ItemCheckUpdate update);

    void verifyAllItems(String transferId);

    void completeLoading(String transferId);

    void arriveAtDestination(String transferId, GeoPoint location);

    String uploadTransferPhoto(String transferId, String fileName, String base64Content);

    void completeHandoff(String transferId, String receivedBy, String photoUrl, String notes);

    void returnTransfer(String transferId, String reason);
}
