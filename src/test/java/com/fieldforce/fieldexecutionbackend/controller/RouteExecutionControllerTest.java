package com.fieldforce.fieldexecutionbackend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldforce.fieldexecutionbackend.dto.CheckInResult;
import com.fieldforce.fieldexecutionbackend.dto.LocationRequest;
import com.fieldforce.fieldexecutionbackend.dto.RouteBoard;
import com.fieldforce.fieldexecutionbackend.dto.VisitBoard;
import com.fieldforce.fieldexecutionbackend.exception.BackendUnavailableException;
import com.fieldforce.fieldexecutionbackend.exception.ExecutionValidationException;
import com.fieldforce.fieldexecutionbackend.execution.CompletionCoordinator;
import com.fieldforce.fieldexecutionbackend.execution.SessionContext;
import com.fieldforce.fieldexecutionbackend.execution.SessionRegistry;
import com.fieldforce.fieldexecutionbackend.execution.StopSequencer;
import com.fieldforce.fieldexecutionbackend.model.RouteStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RouteExecutionController.class)
@Import(SessionRegistry.class)
class RouteExecutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private StopSequencer stopSequencer;

    @MockBean
    private CompletionCoordinator completionCoordinator;

    private RouteBoard board;

    @BeforeEach
    void setUp() {
        board = new RouteBoard();
        board.setRouteId("ROUTE-2024-0001");
        board.setStatus(RouteStatus.IN_PROGRESS);
        board.setTotalStops(3);
    }

    @Test
    void testGetTodaysRoute() throws Exception {
        when(stopSequencer.loadTodaysRoute(any(SessionContext.class))).thenReturn(Optional.of(board));

        mockMvc.perform(get("/api/routes/today").header("X-Agent-Id", "agent-7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routeId").value("ROUTE-2024-0001"))
                .andExpect(jsonPath("$.status").value("in_progress"))
                .andExpect(jsonPath("$.totalStops").value(3));
    }

    @Test
    void testGetTodaysRoute_none() throws Exception {
        when(stopSequencer.loadTodaysRoute(any(SessionContext.class))).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/routes/today").header("X-Agent-Id", "agent-7"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testAgentHeaderRequired() throws Exception {
        mockMvc.perform(get("/api/routes/today"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("session_required"));

        verifyNoInteractions(stopSequencer);
    }

    @Test
    void testCheckInPassesCoordinates() throws Exception {
        VisitBoard visit = new VisitBoard();
        visit.setVisitId("VISIT-2");
        visit.setCurrentActivity("photos");
        when(stopSequencer.checkIn(any(SessionContext.class), eq(2), eq(-6.2), eq(106.8)))
                .thenReturn(new CheckInResult(board, visit));
        LocationRequest request = new LocationRequest();
        request.setLatitude(-6.2);
        request.setLongitude(106.8);

        mockMvc.perform(post("/api/routes/stops/2/check-in")
                        .header("X-Agent-Id", "agent-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.route.routeId").value("ROUTE-2024-0001"))
                .andExpect(jsonPath("$.visit.currentActivity").value("photos"));
    }

    @Test
    void testLockedCheckInIsUnprocessable() throws Exception {
        when(stopSequencer.checkIn(any(SessionContext.class), eq(3), isNull(), isNull()))
                .thenThrow(new ExecutionValidationException("stop 3 cannot be checked into (locked)"));

        mockMvc.perform(post("/api/routes/stops/3/check-in").header("X-Agent-Id", "agent-7"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("validation_failed"))
                .andExpect(jsonPath("$.reasons[0]").value("stop 3 cannot be checked into (locked)"));
    }

    @Test
    void testBackendDownIsServiceUnavailable() throws Exception {
        when(stopSequencer.startRoute(any(SessionContext.class), isNull(), isNull()))
                .thenThrow(new BackendUnavailableException("frm.api.route.start_route_execution", "timeout", null));

        mockMvc.perform(post("/api/routes/start").header("X-Agent-Id", "agent-7"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("backend_unavailable"));
    }

    @Test
    void testSkipStopUsesReason() throws Exception {
        when(completionCoordinator.skipVisit(any(SessionContext.class), eq(1), eq("Shop closed"))).thenReturn(board);

        mockMvc.perform(post("/api/routes/stops/1/skip")
                        .header("X-Agent-Id", "agent-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"Shop closed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routeId").value("ROUTE-2024-0001"));
    }

    @Test
    void testSameAgentKeepsSession() throws Exception {
        when(stopSequencer.currentBoard(any(SessionContext.class))).thenReturn(board);

        mockMvc.perform(get("/api/routes/current").header("X-Agent-Id", "agent-7")).andExpect(status().isOk());
        mockMvc.perform(get("/api/routes/current").header("X-Agent-Id", "agent-7")).andExpect(status().isOk());

        verify(stopSequencer, times(2)).currentBoard(argThat(s -> "agent-7".equals(s.getAgentId())));
    }
}
