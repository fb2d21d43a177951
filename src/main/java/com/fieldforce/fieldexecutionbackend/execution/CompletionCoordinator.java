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
import com.fieldforce.fieldexecutionbackend.model.Activity;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.RouteStatus;
import com.fieldforce.fieldexecutionbackend.model.Stop;
import com.fieldforce.fieldexecutionbackend.model.StopStatus;
import com.fieldforce.fieldexecutionbackend.model.Transfer;
import com.fieldforce.fieldexecutionbackend.model.TransferStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * The only place terminal transitions are requested: finalizing or skipping a visit, and
 * handing off or returning a transfer. On success the local progress record is purged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionCoordinator {

    static final String RETRY_CONNECTION = "Connection problem, your progress is saved. Please try again.";
    static final String RETRY_GENERIC = "Something went wrong while completing the visit. Please try again.";
    static final String DEFAULT_SKIP_REASON = "Skipped by user";

    private final FieldBackendClient backendClient;
    private final ReconciliationCoordinator reconciliationCoordinator;
    private final StopSequencer stopSequencer;
    private final TransferSequencer transferSequencer;

    // ---------------------------------------------------------------- visits

    public FinalizeOutcome finalizeVisit(SessionContext session, String visitId) {
        ActivitySequence sequence = reconciliationCoordinator.requireSequence(session, visitId);
        Optional<Stop> stop = stopSequencer.stopForUnit(session, visitId);

        // A closed visit has nothing left to gate; the backend treats a repeat as a no-op
        if (!sequence.isReadOnly()) {
            List<Activity> pending = sequence.pendingMandatory();
            if (!pending.isEmpty()) {
                List<String> reasons = pending.stream().map(a -> a.getName() + " is required").toList();
                log.info("Finalize of visit {} blocked, {} mandatory activities pending", visitId, pending.size());
                return FinalizeOutcome.blocked(reasons);
            }
        }

        return session.exclusive(visitId, () -> {
            try {
                FinalizeResponse response = backendClient.finalizeVisit(visitId);
                if (response.hasWarnings()) {
                    log.warn("Visit {} not completed, backend sync warnings: {}", visitId, response.getSyncWarnings());
                    return FinalizeOutcome.syncBlocked(response.getSyncWarnings());
                }

                if (stop.isPresent() && stop.get().getStatus() != StopStatus.COMPLETED) {
                    backendClient.completeStop(stopSequencer.requireRoute(session).getId(), stop.get().getIdx());
                }
            } catch (BackendUnavailableException e) {
                log.warn("Finalize of visit {} needs a retry: {}", visitId, e.getMessage());
                return FinalizeOutcome.retryNeeded(RETRY_CONNECTION);
            } catch (BackendRejectedException e) {
                log.warn("Finalize of visit {} rejected: {}", visitId, e.getMessage());
                return FinalizeOutcome.blocked(List.of(e.getMessage()));
            } catch (FieldBackendException e) {
                log.error("Finalize of visit {} failed unexpectedly", visitId, e);
                return FinalizeOutcome.retryNeeded(RETRY_GENERIC);
            }

            reconciliationCoordinator.purge(session, visitId);
            RouteBoard board = session.currentRoute().isPresent() ? stopSequencer.refreshQuietly(session) : null;
            log.info("Visit {} committed", visitId);
            return FinalizeOutcome.committed(board);
        });
    }

    /**
     * Skips a whole visit stop. Only allowed while nothing has been recorded for the visit.
     */
    public RouteBoard skipVisit(SessionContext session, int stopIdx, String reason) {
        Route route = stopSequencer.requireRoute(session);
        if (route.getStatus() != RouteStatus.IN_PROGRESS) {
            throw new ExecutionValidationException("Route " + route.getId() + " is not in progress");
        }
        Stop stop = route.findStop(stopIdx).orElseThrow(() ->
                new ExecutionValidationException("Route " + route.getId() + " has no stop " + stopIdx));
        StopAccess access = stopSequencer.computeAccess(route).get(stopIdx);
        if (access != StopAccess.ACTIVE && access != StopAccess.ELIGIBLE) {
            throw new ExecutionValidationException("Stop " + stop.getSequence() + " cannot be skipped");
        }

        String visitId = stop.getVisitId();
        if (visitId != null && reconciliationCoordinator.hasProgress(session, visitId)) {
            throw new ExecutionValidationException("Visit " + visitId
                    + " already has recorded work and cannot be skipped, finalize it instead");
        }

        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_SKIP_REASON : reason;
        return session.exclusive(route.getId(), () -> {
            Route updated = backendClient.skipStop(route.getId(), stopIdx, effectiveReason);
            session.setRoute(updated);
            if (visitId != null) {
                reconciliationCoordinator.purge(session, visitId);
            }
            log.info("Stop {} of route {} skipped: {}", stopIdx, route.getId(), effectiveReason);
            return stopSequencer.refreshQuietly(session);
        });
    }

    // ---------------------------------------------------------------- transfers

    /**
     * Hands the goods over at the destination. The optional photo is uploaded before the status
     * call so a failed upload leaves the transfer untouched.
     */
    public TransferBoard completeHandoff(SessionContext session, String transferId, HandoffRequest request) {
        if (request == null || request.getReceivedBy() == null || request.getReceivedBy().isBlank()) {
            throw new ExecutionValidationException("Enter the name of the person receiving the goods");
        }
        requireTransferStatus(transferId, TransferStatus.ARRIVED);

        return session.exclusive(transferId, () -> {
            String photoUrl = null;
            if (request.getPhotoBase64() != null && !request.getPhotoBase64().isBlank()) {
                photoUrl = backendClient.uploadTransferPhoto(transferId, request.getPhotoFileName(), request.getPhotoBase64());
            }
            backendClient.completeHandoff(transferId, request.getReceivedBy().trim(), photoUrl, request.getNotes());
            reconciliationCoordinator.purge(session, transferId);
            log.info("Transfer {} handed off to {}", transferId, request.getReceivedBy());
            return transferSequencer.refreshAndPublish(session, transferId);
        });
    }

    public TransferBoard returnTransfer(SessionContext session, String transferId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ExecutionValidationException("A reason is required to return a transfer");
        }
        Transfer transfer = backendClient.getTransferDetail(transferId);
        if (transfer.getStatus() == null || !transfer.getStatus().isReturnable()) {
            throw new ExecutionValidationException("Transfer " + transferId + " cannot be returned while "
                    + (transfer.getStatus() == null ? "unknown" : transfer.getStatus().getValue()));
        }

        return session.exclusive(transferId, () -> {
            backendClient.returnTransfer(transferId, reason.trim());
            reconciliationCoordinator.purge(session, transferId);
            log.info("Transfer {} returned: {}", transferId, reason);
            return transferSequencer.refreshAndPublish(session, transferId);
        });
    }

    private void requireTransferStatus(String transferId, TransferStatus expected) {
        Transfer transfer = backendClient.getTransferDetail(transferId);
        if (transfer.getStatus() != expected) {
            throw new ExecutionValidationException("Transfer " + transferId + " is "
                    + (transfer.getStatus() == null ? "unknown" : transfer.getStatus().getValue())
                    + ", expected " + expected.getValue());
        }
    }
}
