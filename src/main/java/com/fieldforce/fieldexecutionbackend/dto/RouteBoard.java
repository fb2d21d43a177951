package com.fieldforce.fieldexecutionbackend.dto;

import com.fieldforce.fieldexecutionbackend.model.RouteStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Route summary pushed to the device after every change: stop access, counts and the
 * route-level actions currently allowed.
 */
@Data
@NoArgsConstructor
public class RouteBoard {
    private String routeId;
    private LocalDate routeDate;
    private RouteStatus status;
    private int totalStops;
    private int completedStops;
    private int skippedStops;
    private int progressPercentage;
    private Integer activeStopIdx;
    private boolean canStart;
    private boolean canEnd;
    private List<StopView> stops = new ArrayList<>();
}
