package com.fieldforce.fieldexecutionbackend.dto;

import com.fieldforce.fieldexecutionbackend.model.StopKind;
import lombok.Data;

@Data
public class UnplannedStopRequest {
    private StopKind kind = StopKind.VISIT;
    private String stopName;
    private String customer;
    private String warehouse;
    private Double latitude;
    private Double longitude;
    private String reason;
    private String notes;
    // Check into the new stop right away
    private boolean checkInNow;
}
