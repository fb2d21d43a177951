package com.fieldforce.fieldexecutionbackend.controller;

import com.fieldforce.fieldexecutionbackend.dto.ReasonRequest;
import com.fieldforce.fieldexecutionbackend.dto.VisitBoard;
import com.fieldforce.fieldexecutionbackend.execution.CompletionCoordinator;
import com.fieldforce.fieldexecutionbackend.execution.FinalizeOutcome;
import com.fieldforce.fieldexecutionbackend.execution.ReconciliationCoordinator;
import com.fieldforce.fieldexecutionbackend.execution.SessionRegistry;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Visits", description = "Gated visit activities, media and finalization")
@RestController
@RequestMapping("/api/visits")
public class VisitController {

    @Autowired
    private SessionRegistry sessionRegistry;

    @Autowired
    private ReconciliationCoordinator reconciliationCoordinator;

    @Autowired
    private CompletionCoordinator completionCoordinator;

    @Operation(summary = "Get visit", description = "Activities with their access, merged from device and server progress")
    @GetMapping("/{visitId}")
    public ResponseEntity<VisitBoard> getVisit(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                               @PathVariable String visitId) {
        return ResponseEntity.ok(reconciliationCoordinator.visitBoard(sessionRegistry.forAgent(agentId), visitId));
    }

    @Operation(summary = "Complete activity", description = "Completes the current activity, or amends a completed one")
    @ApiResponse(responseCode = "200", description = "Activity recorded; warnings list any sync problem")
    @ApiResponse(responseCode = "422", description = "Activity is locked or the visit is closed")
    @PostMapping("/{visitId}/activities/{activityKey}/complete")
    public ResponseEntity<VisitBoard> completeActivity(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                       @PathVariable String visitId,
                                                       @PathVariable String activityKey,
                                                       @RequestBody(required = false) ActivityResult result) {
        return ResponseEntity.ok(reconciliationCoordinator.completeActivity(
                sessionRegistry.forAgent(agentId), visitId, activityKey, result));
    }

    @Operation(summary = "Skip activity", description = "Skips the current optional activity")
    @ApiResponse(responseCode = "422", description = "Activity is mandatory or not current")
    @PostMapping("/{visitId}/activities/{activityKey}/skip")
    public ResponseEntity<VisitBoard> skipActivity(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                   @PathVariable String visitId,
                                                   @PathVariable String activityKey,
                                                   @RequestBody(required = false) ReasonRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(reconciliationCoordinator.skipActivity(
                sessionRegistry.forAgent(agentId), visitId, activityKey, reason));
    }

    @Operation(summary = "Add media", description = "Records a captured photo and attaches it to the visit")
    @PostMapping("/{visitId}/media")
    public ResponseEntity<VisitBoard> captureMedia(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                   @PathVariable String visitId,
                                                   @RequestBody MediaRef media) {
        return ResponseEntity.ok(reconciliationCoordinator.captureMedia(sessionRegistry.forAgent(agentId), visitId, media));
    }

    @Operation(summary = "Finalize visit", description = "Completes the visit and its stop")
    @ApiResponse(responseCode = "200", description = "Committed")
    @ApiResponse(responseCode = "409", description = "Blocked: pending mandatory activities, sync warnings or a server rejection")
    @ApiResponse(responseCode = "503", description = "Retry needed")
    @PostMapping("/{visitId}/finalize")
    public ResponseEntity<FinalizeOutcome> finalizeVisit(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                                         @PathVariable String visitId) {
        FinalizeOutcome outcome = completionCoordinator.finalizeVisit(sessionRegistry.forAgent(agentId), visitId);
        switch (outcome.getStatus()) {
            case COMMITTED:
                return ResponseEntity.ok(outcome);
            case BLOCKED:
                return ResponseEntity.status(HttpStatus.CONFLICT).body(outcome);
            default:
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(outcome);
        }
    }
}
