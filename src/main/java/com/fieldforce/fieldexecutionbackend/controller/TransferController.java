package com.fieldforce.fieldexecutionbackend.controller;

import com.fieldforce.fieldexecutionbackend.dto.HandoffRequest;
import com.fieldforce.fieldexecutionbackend.dto.ItemCheckUpdate;
import com.fieldforce.fieldexecutionbackend.dto.LocationRequest;
import com.fieldforce.fieldexecutionbackend.dto.ReasonRequest;
import com.fieldforce.fieldexecutionbackend.dto.TransferBoard;
import com.fieldforce.fieldexecutionbackend.execution.CompletionCoordinator;
import com.fieldforce.fieldexecutionbackend.execution.SessionRegistry;
import com.fieldforce.fieldexecutionbackend.execution.TransferSequencer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Transfers", description = "Stock transfer loading, transit, arrival, handoff and return")
@RestController
@RequestMapping("/api/transfers")
public class TransferController {

    @Autowired
    private SessionRegistry sessionRegistry;

    @Autowired
    private TransferSequencer transferSequencer;

    @Autowired
    private CompletionCoordinator completionCoordinator;

    @Operation(summary = "Get transfer", description = "Transfer detail with the actions currently permitted")
    @GetMapping("/{transferId}")
    public ResponseEntity<TransferBoard> getTransfer(@PathVariable String transferId) {
        return ResponseEntity.ok(transferSequencer.getTransfer(transferId));
    }

    @Operation(summary = "Start loading check")
    @ApiResponse(responseCode = "422", description = "Transfer is not pending")
    @PostMapping("/{transferId}/start-loading")
    public ResponseEntity<TransferBoard> startLoading(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                      @PathVariable String transferId) {
        return ResponseEntity.ok(transferSequencer.startLoading(sessionRegistry.forAgent(agentId), transferId));
    }

    @Operation(summary = "Record item check", description = "Counts verified, damaged and missing quantities of one product")
    @ApiResponse(responseCode = "422", description = "Counts exceed the expected quantity or transfer not loading")
    @PostMapping("/{transferId}/items/check")
    public ResponseEntity<TransferBoard> recordItemCheck(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                         @PathVariable String transferId,
                                                         @RequestBody ItemCheckUpdate update) {
        return ResponseEntity.ok(transferSequencer.recordItemCheck(sessionRegistry.forAgent(agentId), transferId, update));
    }

    @Operation(summary = "Verify all items")
    @PostMapping("/{transferId}/verify-all")
    public ResponseEntity<TransferBoard> verifyAll(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                   @PathVariable String transferId) {
        return ResponseEntity.ok(transferSequencer.verifyAll(sessionRegistry.forAgent(agentId), transferId));
    }

    @Operation(summary = "Complete loading", description = "Moves the transfer in transit once every item is checked")
    @ApiResponse(responseCode = "422", description = "Items still pending, listed in reasons")
    @PostMapping("/{transferId}/complete-loading")
    public ResponseEntity<TransferBoard> completeLoading(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                         @PathVariable String transferId) {
        return ResponseEntity.ok(transferSequencer.completeLoading(sessionRegistry.forAgent(agentId), transferId));
    }

    @Operation(summary = "Arrive at destination")
    @PostMapping("/{transferId}/arrive")
    public ResponseEntity<TransferBoard> arrive(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                @PathVariable String transferId,
                                                @RequestBody(required = false) LocationRequest request) {
        LocationRequest location = request != null ? request : new LocationRequest();
        return ResponseEntity.ok(transferSequencer.arrive(sessionRegistry.forAgent(agentId), transferId,
                location.getLatitude(), location.getLongitude()));
    }

    @Operation(summary = "Complete handoff", description = "Hands the goods over; the optional photo is uploaded first")
    @ApiResponse(responseCode = "422", description = "Receiver missing or transfer not arrived")
    @PostMapping("/{transferId}/handoff")
    public ResponseEntity<TransferBoard> completeHandoff(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                         @PathVariable String transferId,
                                                         @RequestBody HandoffRequest request) {
        return ResponseEntity.ok(completionCoordinator.completeHandoff(sessionRegistry.forAgent(agentId), transferId, request));
    }

    @Operation(summary = "Return transfer", description = "Irreversibly returns the transfer to its source")
    @ApiResponse(responseCode = "422", description = "Reason missing or transfer not returnable")
    @PostMapping("/{transferId}/return")
    public ResponseEntity<TransferBoard> returnTransfer(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                        @PathVariable String transferId,
                                                        @RequestBody(required = false) ReasonRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(completionCoordinator.returnTransfer(sessionRegistry.forAgent(agentId), transferId, reason));
    }
}
