package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One agent's route for one day, as last fetched from the field backend.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Route {
    @JsonAlias("name")
    private String id;
    private LocalDate routeDate;
    private String assignedAgent;
    private RouteStatus status = RouteStatus.NOT_STARTED;
    private List<Stop> stops = new ArrayList<>();

    private int totalStops;
    private int completedStops;
    private int skippedStops;

    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private GeoPoint startLocation;
    private GeoPoint endLocation;
    private String notes;

    public Optional<Stop> findStop(int idx) {
        if (stops == null) {
            return Optional.empty();
        }
        return stops.stream().filter(s -> s.getIdx() == idx).findFirst();
    }

    /**
     * Stops in visiting order.
     */
    @JsonIgnore
    public List<Stop> getOrderedStops() {
        if (stops == null) {
            return List.of();
        }
        return stops.stream()
                .sorted(Comparator.comparingInt(Stop::getSequence))
                .toList();
    }

    public int getProgressPercentage() {
        if (stops == null || stops.isEmpty()) {
            return 0;
        }
        long finished = stops.stream().filter(Stop::isTerminal).count();
        return (int) Math.round(finished * 100.0 / stops.size());
    }
}
