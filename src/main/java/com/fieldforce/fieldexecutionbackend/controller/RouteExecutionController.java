package com.fieldforce.fieldexecutionbackend.controller;

import com.fieldforce.fieldexecutionbackend.dto.CheckInResult;
import com.fieldforce.fieldexecutionbackend.dto.LocationRequest;
import com.fieldforce.fieldexecutionbackend.dto.ReasonRequest;
import com.fieldforce.fieldexecutionbackend.dto.RouteBoard;
import com.fieldforce.fieldexecutionbackend.dto.UnplannedStopRequest;
import com.fieldforce.fieldexecutionbackend.execution.CompletionCoordinator;
import com.fieldforce.fieldexecutionbackend.execution.SessionContext;
import com.fieldforce.fieldexecutionbackend.execution.SessionRegistry;
import com.fieldforce.fieldexecutionbackend.execution.StopSequencer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Routes", description = "Daily route execution: start, check-in, skip, unplanned stops, end")
@Slf4j
@RestController
@RequestMapping("/api/routes")
public class RouteExecutionController {

    static final String AGENT_HEADER = "X-Agent-Id";

    @Autowired
    private SessionRegistry sessionRegistry;

    @Autowired
    private StopSequencer stopSequencer;

    @Autowired
    private CompletionCoordinator completionCoordinator;

    @Operation(summary = "Load today's route", description = "Fetches the agent's route for today and computes stop access")
    @ApiResponse(responseCode = "200", description = "Route board")
    @ApiResponse(responseCode = "404", description = "No route assigned for today")
    @GetMapping("/today")
    public ResponseEntity<RouteBoard> getTodaysRoute(@RequestHeader(AGENT_HEADER) String agentId) {
        SessionContext session = sessionRegistry.forAgent(agentId);
        return stopSequencer.loadTodaysRoute(session)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Current route board", description = "Board of the route held by the session, without a server round-trip")
    @GetMapping("/current")
    public ResponseEntity<RouteBoard> getCurrentRoute(@RequestHeader(AGENT_HEADER) String agentId) {
        return ResponseEntity.ok(stopSequencer.currentBoard(sessionRegistry.forAgent(agentId)));
    }

    @Operation(summary = "Refresh route", description = "Re-fetches the route from the server and publishes the board")
    @PostMapping("/current/refresh")
    public ResponseEntity<RouteBoard> refresh(@RequestHeader(AGENT_HEADER) String agentId) {
        return ResponseEntity.ok(stopSequencer.refresh(sessionRegistry.forAgent(agentId)));
    }

    @Operation(summary = "Start route", description = "Starts a route that has not been started yet")
    @ApiResponse(responseCode = "200", description = "Route started")
    @ApiResponse(responseCode = "422", description = "Route is not in not_started")
    @PostMapping("/start")
    public ResponseEntity<RouteBoard> startRoute(@RequestHeader(AGENT_HEADER) String agentId,
                                                 @RequestBody(required = false) LocationRequest request) {
        LocationRequest location = request != null ? request : new LocationRequest();
        return ResponseEntity.ok(stopSequencer.startRoute(sessionRegistry.forAgent(agentId),
                location.getLatitude(), location.getLongitude()));
    }

    @Operation(summary = "End route", description = "Ends an in-progress route with no active stop")
    @ApiResponse(responseCode = "200", description = "Route ended")
    @ApiResponse(responseCode = "422", description = "Route not in progress or a stop is still active")
    @PostMapping("/end")
    public ResponseEntity<RouteBoard> endRoute(@RequestHeader(AGENT_HEADER) String agentId,
                                               @RequestBody(required = false) LocationRequest request) {
        LocationRequest location = request != null ? request : new LocationRequest();
        return ResponseEntity.ok(stopSequencer.endRoute(sessionRegistry.forAgent(agentId),
                location.getLatitude(), location.getLongitude(), location.getNotes()));
    }

    @Operation(summary = "Check in", description = "Checks into an eligible stop and activates its visit")
    @ApiResponse(responseCode = "200", description = "Checked in")
    @ApiResponse(responseCode = "422", description = "Stop is locked or already closed")
    @PostMapping("/stops/{stopIdx}/check-in")
    public ResponseEntity<CheckInResult> checkIn(@RequestHeader(AGENT_HEADER) String agentId,
                                                 @PathVariable int stopIdx,
                                                 @RequestBody(required = false) LocationRequest request) {
        LocationRequest location = request != null ? request : new LocationRequest();
        return ResponseEntity.ok(stopSequencer.checkIn(sessionRegistry.forAgent(agentId), stopIdx,
                location.getLatitude(), location.getLongitude()));
    }

    @Operation(summary = "Skip stop", description = "Skips a whole visit. Rejected once any work was recorded for it")
    @ApiResponse(responseCode = "200", description = "Stop skipped")
    @ApiResponse(responseCode = "422", description = "Visit already has progress")
    @PostMapping("/stops/{stopIdx}/skip")
    public ResponseEntity<RouteBoard> skipStop(@RequestHeader(AGENT_HEADER) String agentId,
                                               @PathVariable int stopIdx,
                                               @RequestBody(required = false) ReasonRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(completionCoordinator.skipVisit(sessionRegistry.forAgent(agentId), stopIdx, reason));
    }

    @Operation(summary = "Add unplanned stop", description = "Appends a stop at the end of the route, optionally checking in right away")
    @ApiResponse(responseCode = "200", description = "Stop added")
    @PostMapping("/stops/unplanned")
    public ResponseEntity<CheckInResult> addUnplannedStop(@RequestHeader(AGENT_HEADER) String agentId,
                                                          @RequestBody UnplannedStopRequest request) {
        log.info("Unplanned stop requested by {}: {}", agentId, request.getCustomer());
        return ResponseEntity.ok(stopSequencer.addUnplannedStop(sessionRegistry.forAgent(agentId), request));
    }
}
