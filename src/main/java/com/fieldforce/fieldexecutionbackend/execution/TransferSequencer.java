package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.client.FieldBackendClient;
import com.fieldforce.fieldexecutionbackend.dto.ItemCheckUpdate;
import com.fieldforce.fieldexecutionbackend.dto.TransferBoard;
import com.fieldforce.fieldexecutionbackend.exception.ExecutionValidationException;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import com.fieldforce.fieldexecutionbackend.model.ItemCheckStatus;
import com.fieldforce.fieldexecutionbackend.model.Transfer;
import com.fieldforce.fieldexecutionbackend.model.TransferItemCheck;
import com.fieldforce.fieldexecutionbackend.model.TransferStatus;
import com.fieldforce.fieldexecutionbackend.service.TransferUpdatePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drives a stock transfer through pending, loading, in transit and arrived. The terminal
 * handoff and return go through {@link CompletionCoordinator}.
 * <p>
 * Every transition re-fetches the transfer and publishes it with the actions now permitted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferSequencer {

    private final FieldBackendClient backendClient;
    private final ReconciliationCoordinator reconciliationCoordinator;
    private final LocationCapture locationCapture;
    private final TransferUpdatePublisher transferUpdatePublisher;

    public TransferBoard getTransfer(String transferId) {
        return board(backendClient.getTransferDetail(transferId));
    }

    public Set<TransferAction> permittedActions(Transfer transfer) {
        TransferStatus status = transfer.getStatus();
        if (status == null) {
            return EnumSet.noneOf(TransferAction.class);
        }
        switch (status) {
            case PENDING:
                return EnumSet.of(TransferAction.START_LOADING);
            case LOADING:
                EnumSet<TransferAction> loading = EnumSet.of(TransferAction.RECORD_ITEM_CHECK,
                        TransferAction.VERIFY_ALL_ITEMS, TransferAction.RETURN);
                if (transfer.getUnaccountedItems().isEmpty()) {
                    loading.add(TransferAction.COMPLETE_LOADING);
                }
                return loading;
            case IN_TRANSIT:
                return EnumSet.of(TransferAction.ARRIVE, TransferAction.RETURN);
            case ARRIVED:
                return EnumSet.of(TransferAction.COMPLETE_HANDOFF, TransferAction.RETURN);
            default:
                return EnumSet.noneOf(TransferAction.class);
        }
    }

    public TransferBoard board(Transfer transfer) {
        List<String> pending = transfer.getUnaccountedItems().stream()
                .map(TransferItemCheck::getProductCode)
                .toList();
        return new TransferBoard(transfer, permittedActions(transfer),
                transfer.getLoadingProgressPercentage(), pending, new ArrayList<>());
    }

    public TransferBoard startLoading(SessionContext session, String transferId) {
        Transfer transfer = fetchInStatus(transferId, TransferStatus.PENDING);
        return session.exclusive(transferId, () -> {
            backendClient.startLoadingCheck(transferId);
            reconciliationCoordinator.openTransfer(session, transferId);
            log.info("Loading check started for transfer {} ({} items)", transferId, transfer.getItems().size());
            return refreshAndPublish(session, transferId);
        });
    }

    /**
     * Records the counted quantities of one product. The status is derived from the counts, or
     * {@code rejected} when the whole line is refused.
     */
    public TransferBoard recordItemCheck(SessionContext session, String transferId, ItemCheckUpdate update) {
        if (update == null || update.getProductCode() == null || update.getProductCode().isBlank()) {
            throw new ExecutionValidationException("Product code is required");
        }
        if (update.getVerifiedQty() < 0 || update.getDamagedQty() < 0 || update.getMissingQty() < 0) {
            throw new ExecutionValidationException("Quantities cannot be negative");
        }
        Transfer transfer = fetchInStatus(transferId, TransferStatus.LOADING);
        TransferItemCheck item = transfer.getItems().stream()
                .filter(i -> update.getProductCode().equals(i.getProductCode()))
                .findFirst()
                .orElseThrow(() -> new ExecutionValidationException(
                        "Transfer " + transferId + " has no item " + update.getProductCode()));

        double counted = update.getVerifiedQty() + update.getDamagedQty() + update.getMissingQty();
        if (counted > item.getExpectedQty()) {
            throw new ExecutionValidationException("Counted " + counted + " of " + update.getProductCode()
                    + " but only " + item.getExpectedQty() + " expected");
        }

        ItemCheckStatus status = update.isRejected()
                ? ItemCheckStatus.REJECTED
                : ItemCheckStatus.derive(item.getExpectedQty(), update.getVerifiedQty(),
                        update.getDamagedQty(), update.getMissingQty());
        return session.exclusive(transferId, () -> {
            backendClient.updateItemCheck(transferId, update);
            log.info("Item {} of transfer {} checked: {}", update.getProductCode(), transferId, status.getValue());
            TransferBoard board = refreshAndPublish(session, transferId);
            board.getTransfer().getItems().stream()
                    .filter(i -> update.getProductCode().equals(i.getProductCode()))
                    .findFirst()
                    .filter(i -> i.getCheckStatus() != status)
                    .ifPresent(i -> {
                        String recorded = i.getCheckStatus() == null ? "unknown" : i.getCheckStatus().getValue();
                        log.warn("Item {} of transfer {} counted as {} but recorded as {}",
                                update.getProductCode(), transferId, status.getValue(), recorded);
                        board.getWarnings().add(update.getProductCode() + " counted as " + status.getValue()
                                + " but the server recorded it as " + recorded);
                    });
            return board;
        });
    }

    public TransferBoard verifyAll(SessionContext session, String transferId) {
        fetchInStatus(transferId, TransferStatus.LOADING);
        return session.exclusive(transferId, () -> {
            backendClient.verifyAllItems(transferId);
            log.info("All items of transfer {} verified", transferId);
            return refreshAndPublish(session, transferId);
        });
    }

    public TransferBoard completeLoading(SessionContext session, String transferId) {
        Transfer transfer = fetchInStatus(transferId, TransferStatus.LOADING);
        List<TransferItemCheck> unaccounted = transfer.getUnaccountedItems();
        if (!unaccounted.isEmpty()) {
            List<String> reasons = unaccounted.stream()
                    .map(i -> (i.getProductName() != null ? i.getProductName() : i.getProductCode()) + " is not checked yet")
                    .toList();
            throw new ExecutionValidationException(unaccounted.size() + " item(s) still pending", reasons);
        }
        return session.exclusive(transferId, () -> {
            backendClient.completeLoading(transferId);
            log.info("Loading of transfer {} completed, now in transit", transferId);
            return refreshAndPublish(session, transferId);
        });
    }

    public TransferBoard arrive(SessionContext session, String transferId, Double latitude, Double longitude) {
        fetchInStatus(transferId, TransferStatus.IN_TRANSIT);
        return session.exclusive(transferId, () -> {
            GeoPoint location = locationCapture.resolve(session, latitude, longitude);
            backendClient.arriveAtDestination(transferId, location);
            log.info("Transfer {} arrived at destination {}", transferId, location);
            return refreshAndPublish(session, transferId);
        });
    }

    /**
     * Re-fetches the transfer, records which items are accounted for while loading, and
     * publishes the board.
     */
    public TransferBoard refreshAndPublish(SessionContext session, String transferId) {
        Transfer fresh = backendClient.getTransferDetail(transferId);
        if (fresh.getStatus() == TransferStatus.LOADING) {
            List<String> accounted = fresh.getItems().stream()
                    .filter(i -> i.getCheckStatus() != null && i.getCheckStatus().isTerminal())
                    .map(TransferItemCheck::getProductCode)
                    .toList();
            reconciliationCoordinator.trackLoadedItems(session, transferId, accounted);
        }
        TransferBoard board = board(fresh);
        transferUpdatePublisher.publishTransferBoard(board);
        return board;
    }

    Transfer fetchInStatus(String transferId, TransferStatus... allowed) {
        Transfer transfer = backendClient.getTransferDetail(transferId);
        for (TransferStatus status : allowed) {
            if (transfer.getStatus() == status) {
                return transfer;
            }
        }
        String expected = Arrays.stream(allowed).map(TransferStatus::getValue).collect(Collectors.joining(" or "));
        throw new ExecutionValidationException("Transfer " + transferId + " is "
                + (transfer.getStatus() == null ? "unknown" : transfer.getStatus().getValue())
                + ", expected " + expected);
    }
}
