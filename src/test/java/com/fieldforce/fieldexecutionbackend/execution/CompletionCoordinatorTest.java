package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.client.FieldBackendClient;
import com.fieldforce.fieldexecutionbackend.dto.FinalizeResponse;
import com.fieldforce.fieldexecutionbackend.dto.HandoffRequest;
import com.fieldforce.fieldexecutionbackend.dto.RouteBoard;
import com.fieldforce.fieldexecutionbackend.dto.TransferBoard;
import com.fieldforce.fieldexecutionbackend.exception.BackendRejectedException;
import com.fieldforce.fieldexecutionbackend.exception.BackendUnavailableException;
import com.fieldforce.fieldexecutionbackend.exception.ExecutionValidationException;
import com.fieldforce.fieldexecutionbackend.exception.FieldBackendException;
import com.fieldforce.fieldexecutionbackend.model.ItemCheckStatus;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.RouteStatus;
import com.fieldforce.fieldexecutionbackend.model.Stop;
import com.fieldforce.fieldexecutionbackend.model.StopStatus;
import com.fieldforce.fieldexecutionbackend.model.TransferStatus;
import com.fieldforce.fieldexecutionbackend.model.VisitStatus;
import com.fieldforce.fieldexecutionbackend.store.ProgressStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.fieldforce.fieldexecutionbackend.execution.ExecutionFixtures.ROUTE_ID;
import static com.fieldforce.fieldexecutionbackend.execution.ExecutionFixtures.route;
import static com.fieldforce.fieldexecutionbackend.execution.ExecutionFixtures.transfer;
import static com.fieldforce.fieldexecutionbackend.execution.ExecutionFixtures.visitStop;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompletionCoordinatorTest {

    private static final String VISIT_ID = "VISIT-1";
    private static final String TRANSFER_ID = "STE-0001";

    @Mock
    private FieldBackendClient backendClient;

    @Mock
    private ReconciliationCoordinator reconciliationCoordinator;

    @Mock
    private StopSequencer stopSequencer;

    @Mock
    private TransferSequencer transferSequencer;

    private CompletionCoordinator coordinator;
    private SessionContext session;
    private Route route;

    @BeforeEach
    void setUp() {
        coordinator = new CompletionCoordinator(backendClient, reconciliationCoordinator, stopSequencer, transferSequencer);
        session = new SessionContext(ExecutionFixtures.AGENT_ID);
        route = route(RouteStatus.IN_PROGRESS, visitStop(1, StopStatus.ARRIVED), visitStop(2, StopStatus.PENDING));
        session.setRoute(route);
    }

    private ActivitySequence sequence(Set<String> completed, boolean readOnly) {
        return new ActivitySequence(VISIT_ID, ExecutionFixtures.standardActivities(), completed, Set.of(), readOnly);
    }

    private FinalizeResponse response(String... warnings) {
        FinalizeResponse response = new FinalizeResponse();
        response.setVisitId(VISIT_ID);
        response.setStatus(warnings.length == 0 ? "Completed" : "In Progress");
        response.setSyncWarnings(List.of(warnings));
        return response;
    }

    private void readyToFinalize() {
        when(reconciliationCoordinator.requireSequence(session, VISIT_ID))
                .thenReturn(sequence(Set.of("photos", "stock_opname"), false));
        when(stopSequencer.stopForUnit(session, VISIT_ID)).thenReturn(Optional.of(visitStop(1, StopStatus.ARRIVED)));
    }

    @Test
    void testPendingMandatoryBlocksWithoutNetworkCall() {
        when(reconciliationCoordinator.requireSequence(session, VISIT_ID)).thenReturn(sequence(Set.of("photos"), false));

        FinalizeOutcome outcome = coordinator.finalizeVisit(session, VISIT_ID);

        assertEquals(FinalizeOutcome.Status.BLOCKED, outcome.getStatus());
        assertEquals(List.of("Stock Opname is required"), outcome.getReasons());
        verifyNoInteractions(backendClient);
    }

    @Test
    void testSyncWarningsKeepVisitOpen() {
        readyToFinalize();
        when(backendClient.finalizeVisit(VISIT_ID)).thenReturn(response("Stock ledger entry could not be posted"));

        FinalizeOutcome outcome = coordinator.finalizeVisit(session, VISIT_ID);

        assertEquals(FinalizeOutcome.Status.BLOCKED, outcome.getStatus());
        assertTrue(outcome.isSyncWarnings());
        assertEquals(List.of("Stock ledger entry could not be posted"), outcome.getReasons());
        verify(backendClient, never()).completeStop(anyString(), anyInt());
        verify(reconciliationCoordinator, never()).purge(any(), anyString());
    }

    @Test
    void testCommitCompletesStopThenPurgesRecord() {
        readyToFinalize();
        RouteBoard refreshed = new RouteBoard();
        when(backendClient.finalizeVisit(VISIT_ID)).thenReturn(response());
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(stopSequencer.refreshQuietly(session)).thenReturn(refreshed);

        FinalizeOutcome outcome = coordinator.finalizeVisit(session, VISIT_ID);

        assertTrue(outcome.isCommitted());
        assertSame(refreshed, outcome.getRoute());
        InOrder order = inOrder(backendClient, reconciliationCoordinator, stopSequencer);
        order.verify(backendClient).finalizeVisit(VISIT_ID);
        order.verify(backendClient).completeStop(ROUTE_ID, 1);
        order.verify(reconciliationCoordinator).purge(session, VISIT_ID);
        order.verify(stopSequencer).refreshQuietly(session);
    }

    @Test
    void testRepeatedFinalizeCompletesStopOnce() {
        when(reconciliationCoordinator.requireSequence(session, VISIT_ID))
                .thenReturn(sequence(Set.of("photos", "stock_opname"), false))
                .thenReturn(sequence(Set.of("photos", "stock_opname"), true));
        when(stopSequencer.stopForUnit(session, VISIT_ID))
                .thenReturn(Optional.of(visitStop(1, StopStatus.ARRIVED)))
                .thenReturn(Optional.of(visitStop(1, StopStatus.COMPLETED)));
        when(backendClient.finalizeVisit(VISIT_ID)).thenReturn(response());
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(stopSequencer.refreshQuietly(session)).thenReturn(new RouteBoard());

        FinalizeOutcome first = coordinator.finalizeVisit(session, VISIT_ID);
        FinalizeOutcome second = coordinator.finalizeVisit(session, VISIT_ID);

        assertTrue(first.isCommitted());
        assertTrue(second.isCommitted());
        verify(backendClient, times(2)).finalizeVisit(VISIT_ID);
        verify(backendClient, times(1)).completeStop(ROUTE_ID, 1);
    }

    @Test
    void testConnectionFailureAsksForRetry() {
        readyToFinalize();
        when(backendClient.finalizeVisit(VISIT_ID))
                .thenThrow(new BackendUnavailableException("frm.api.visit.complete", "Read timed out", null));

        FinalizeOutcome outcome = coordinator.finalizeVisit(session, VISIT_ID);

        assertEquals(FinalizeOutcome.Status.RETRY_NEEDED, outcome.getStatus());
        assertEquals(List.of(CompletionCoordinator.RETRY_CONNECTION), outcome.getReasons());
        verify(reconciliationCoordinator, never()).purge(any(), anyString());
    }

    @Test
    void testBackendRejectionBlocksWithItsMessage() {
        readyToFinalize();
        when(backendClient.finalizeVisit(VISIT_ID))
                .thenThrow(new BackendRejectedException("frm.api.visit.complete", 417, "Visit is not checked in", null));

        FinalizeOutcome outcome = coordinator.finalizeVisit(session, VISIT_ID);

        assertEquals(FinalizeOutcome.Status.BLOCKED, outcome.getStatus());
        assertEquals(List.of("Visit is not checked in"), outcome.getReasons());
    }

    @Test
    void testStopCompletionFailureAsksForRetry() {
        readyToFinalize();
        when(backendClient.finalizeVisit(VISIT_ID)).thenReturn(response());
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(backendClient.completeStop(ROUTE_ID, 1))
                .thenThrow(new FieldBackendException("update_route_stop_status", "Internal error", null));

        FinalizeOutcome outcome = coordinator.finalizeVisit(session, VISIT_ID);

        assertEquals(FinalizeOutcome.Status.RETRY_NEEDED, outcome.getStatus());
        assertEquals(List.of(CompletionCoordinator.RETRY_GENERIC), outcome.getReasons());
        verify(reconciliationCoordinator, never()).purge(any(), anyString());
    }

    @Test
    void testSkipRejectedOnceVisitHasProgress() {
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(stopSequencer.computeAccess(route)).thenReturn(Map.of(1, StopAccess.ACTIVE, 2, StopAccess.LOCKED));
        when(reconciliationCoordinator.hasProgress(session, VISIT_ID)).thenReturn(true);

        assertThrows(ExecutionValidationException.class, () -> coordinator.skipVisit(session, 1, "Shop closed"));
        verify(backendClient, never()).skipStop(anyString(), anyInt(), anyString());
    }

    private ReconciliationCoordinator realReconciliation(ProgressStore progressStore) {
        return new ReconciliationCoordinator(progressStore, backendClient, new ProgressMerger(),
                new ActivityCatalog(ExecutionFixtures.properties()));
    }

    @Test
    void testSkipRejectedAfterActivityCompletedThroughReconciliation() {
        ProgressStore progressStore = mock(ProgressStore.class);
        ReconciliationCoordinator reconciliation = realReconciliation(progressStore);
        CompletionCoordinator completion = new CompletionCoordinator(backendClient, reconciliation, stopSequencer, transferSequencer);
        when(backendClient.getVisit(VISIT_ID))
                .thenReturn(ExecutionFixtures.visit(VISIT_ID, VisitStatus.IN_PROGRESS, new ArrayList<>()));
        when(backendClient.getVisitMedia(VISIT_ID)).thenReturn(List.of());
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(stopSequencer.computeAccess(route)).thenReturn(Map.of(1, StopAccess.ACTIVE, 2, StopAccess.LOCKED));

        reconciliation.activateVisit(session, VISIT_ID, true);
        reconciliation.captureMedia(session, VISIT_ID, new MediaRef("img-1", "/files/img-1.jpg", "img-1.jpg", null));
        reconciliation.completeActivity(session, VISIT_ID, "photos", null);

        assertThrows(ExecutionValidationException.class, () -> completion.skipVisit(session, 1, "Shop closed"));
        verify(backendClient, never()).skipStop(anyString(), anyInt(), anyString());
        assertTrue(session.sequence(VISIT_ID).orElseThrow().isCompleted("photos"));
    }

    @Test
    void testSkipUntouchedVisitLeavesNoRecordBehind() {
        ProgressStore progressStore = mock(ProgressStore.class);
        ReconciliationCoordinator reconciliation = realReconciliation(progressStore);
        CompletionCoordinator completion = new CompletionCoordinator(backendClient, reconciliation, stopSequencer, transferSequencer);
        Route skipped = route(RouteStatus.IN_PROGRESS, visitStop(1, StopStatus.SKIPPED), visitStop(2, StopStatus.PENDING));
        when(backendClient.getVisit(VISIT_ID))
                .thenReturn(ExecutionFixtures.visit(VISIT_ID, VisitStatus.PLANNED, new ArrayList<>()));
        when(backendClient.getVisitMedia(VISIT_ID)).thenReturn(List.of());
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(stopSequencer.computeAccess(route)).thenReturn(Map.of(1, StopAccess.ACTIVE, 2, StopAccess.LOCKED));
        when(backendClient.skipStop(ROUTE_ID, 1, "Shop closed")).thenReturn(skipped);
        when(stopSequencer.refreshQuietly(session)).thenReturn(new RouteBoard());

        completion.skipVisit(session, 1, "Shop closed");

        verify(progressStore, never()).save(any(ProgressRecord.class));
        verify(progressStore).purge(VISIT_ID);
        assertTrue(session.workingRecord(VISIT_ID).isEmpty());
    }

    @Test
    void testSkipUntouchedVisit() {
        Route skipped = route(RouteStatus.IN_PROGRESS, visitStop(1, StopStatus.SKIPPED), visitStop(2, StopStatus.PENDING));
        RouteBoard refreshed = new RouteBoard();
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(stopSequencer.computeAccess(route)).thenReturn(Map.of(1, StopAccess.ACTIVE, 2, StopAccess.LOCKED));
        when(reconciliationCoordinator.hasProgress(session, VISIT_ID)).thenReturn(false);
        when(backendClient.skipStop(ROUTE_ID, 1, CompletionCoordinator.DEFAULT_SKIP_REASON)).thenReturn(skipped);
        when(stopSequencer.refreshQuietly(session)).thenReturn(refreshed);

        RouteBoard board = coordinator.skipVisit(session, 1, " ");

        assertSame(refreshed, board);
        assertSame(skipped, session.getRoute());
        verify(reconciliationCoordinator).purge(session, VISIT_ID);
    }

    @Test
    void testSkipRejectedForLockedStop() {
        when(stopSequencer.requireRoute(session)).thenReturn(route);
        when(stopSequencer.computeAccess(route)).thenReturn(Map.of(1, StopAccess.ACTIVE, 2, StopAccess.LOCKED));

        assertThrows(ExecutionValidationException.class, () -> coordinator.skipVisit(session, 2, "Too far"));
        verifyNoInteractions(backendClient);
    }

    @Test
    void testHandoffNeedsReceiver() {
        HandoffRequest request = new HandoffRequest("  ", null, null, null);

        assertThrows(ExecutionValidationException.class, () -> coordinator.completeHandoff(session, TRANSFER_ID, request));
        verifyNoInteractions(backendClient);
    }

    @Test
    void testHandoffUploadsPhotoBeforeStatusChange() {
        when(backendClient.getTransferDetail(TRANSFER_ID))
                .thenReturn(transfer(TRANSFER_ID, TransferStatus.ARRIVED, ItemCheckStatus.VERIFIED));
        when(backendClient.uploadTransferPhoto(TRANSFER_ID, "handoff.jpg", "aGFuZG9mZg=="))
                .thenReturn("/files/handoff.jpg");
        TransferBoard board = new TransferBoard();
        when(transferSequencer.refreshAndPublish(session, TRANSFER_ID)).thenReturn(board);

        TransferBoard result = coordinator.completeHandoff(session, TRANSFER_ID,
                new HandoffRequest(" Budi ", "aGFuZG9mZg==", "handoff.jpg", "Two cartons dented"));

        assertSame(board, result);
        InOrder order = inOrder(backendClient, reconciliationCoordinator);
        order.verify(backendClient).uploadTransferPhoto(TRANSFER_ID, "handoff.jpg", "aGFuZG9mZg==");
        order.verify(backendClient).completeHandoff(TRANSFER_ID, "Budi", "/files/handoff.jpg", "Two cartons dented");
        order.verify(reconciliationCoordinator).purge(session, TRANSFER_ID);
    }

    @Test
    void testFailedPhotoUploadLeavesTransferUntouched() {
        when(backendClient.getTransferDetail(TRANSFER_ID))
                .thenReturn(transfer(TRANSFER_ID, TransferStatus.ARRIVED, ItemCheckStatus.VERIFIED));
        when(backendClient.uploadTransferPhoto(anyString(), any(), anyString()))
                .thenThrow(new BackendUnavailableException("upload_file", "Connection reset", null));

        assertThrows(BackendUnavailableException.class, () -> coordinator.completeHandoff(session, TRANSFER_ID,
                new HandoffRequest("Budi", "aGFuZG9mZg==", null, null)));
        verify(backendClient, never()).completeHandoff(anyString(), anyString(), any(), any());
        verify(reconciliationCoordinator, never()).purge(any(), anyString());
    }

    @Test
    void testHandoffOnlyAfterArrival() {
        when(backendClient.getTransferDetail(TRANSFER_ID))
                .thenReturn(transfer(TRANSFER_ID, TransferStatus.IN_TRANSIT, ItemCheckStatus.VERIFIED));

        assertThrows(ExecutionValidationException.class,
                () -> coordinator.completeHandoff(session, TRANSFER_ID, new HandoffRequest("Budi", null, null, null)));
        verify(backendClient, never()).completeHandoff(anyString(), anyString(), any(), any());
    }

    @Test
    void testReturnNeedsReason() {
        assertThrows(ExecutionValidationException.class, () -> coordinator.returnTransfer(session, TRANSFER_ID, ""));
        verifyNoInteractions(backendClient);
    }

    @Test
    void testReturnRejectedBeforeLoading() {
        when(backendClient.getTransferDetail(TRANSFER_ID))
                .thenReturn(transfer(TRANSFER_ID, TransferStatus.PENDING, ItemCheckStatus.PENDING));

        assertThrows(ExecutionValidationException.class,
                () -> coordinator.returnTransfer(session, TRANSFER_ID, "Truck broke down"));
        verify(backendClient, never()).returnTransfer(anyString(), anyString());
    }

    @Test
    void testReturnInTransit() {
        when(backendClient.getTransferDetail(TRANSFER_ID))
                .thenReturn(transfer(TRANSFER_ID, TransferStatus.IN_TRANSIT, ItemCheckStatus.VERIFIED));
        when(transferSequencer.refreshAndPublish(session, TRANSFER_ID)).thenReturn(new TransferBoard());

        coordinator.returnTransfer(session, TRANSFER_ID, " Truck broke down ");

        verify(backendClient).returnTransfer(TRANSFER_ID, "Truck broke down");
        verify(reconciliationCoordinator).purge(session, TRANSFER_ID);
    }
}
