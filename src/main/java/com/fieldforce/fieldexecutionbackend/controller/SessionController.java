package com.fieldforce.fieldexecutionbackend.controller;

import com.fieldforce.fieldexecutionbackend.dto.LocationRequest;
import com.fieldforce.fieldexecutionbackend.execution.SessionRegistry;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Session", description = "Agent session state")
@RestController
@RequestMapping("/api/session")
public class SessionController {

    @Autowired
    private SessionRegistry sessionRegistry;

    @Operation(summary = "Report location", description = "Latest device position, used when a transition arrives without coordinates")
    @PostMapping("/location")
    public ResponseEntity<Void> reportLocation(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId,
                                               @RequestBody LocationRequest request) {
        if (request.getLatitude() == null || request.getLongitude() == null) {
            throw new IllegalArgumentException("latitude and longitude are required");
        }
        sessionRegistry.forAgent(agentId).reportLocation(new GeoPoint(request.getLatitude(), request.getLongitude()));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Close session", description = "Forgets the agent's in-memory session; local progress records are kept")
    @DeleteMapping
    public ResponseEntity<Void> close(@RequestHeader(RouteExecutionController.AGENT_HEADER) String agentId) {
        sessionRegistry.close(agentId);
        return ResponseEntity.noContent().build();
    }
}
