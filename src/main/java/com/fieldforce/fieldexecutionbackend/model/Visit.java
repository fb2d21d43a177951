package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Visit {
    @JsonAlias("name")
    private String id;
    private String routeId;
    private Integer stopIdx;
    private String customer;
    private VisitStatus status = VisitStatus.PLANNED;
    private List<Activity> activities = new ArrayList<>();

    private LocalDateTime checkInTime;
    private GeoPoint checkInLocation;
    private LocalDateTime checkOutTime;
    private GeoPoint checkOutLocation;
}
