package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
public class Stop {
    private int idx;
    private int sequence;
    @JsonAlias("stop_type")
    private StopKind kind;
    private String stopName;
    private StopStatus status = StopStatus.PENDING;

    private String customer;
    private String customerName;
    private String warehouse;
    private GeoPoint plannedLocation;

    // Linked unit of work, depending on kind
    @JsonAlias("sales_visit")
    private String visitId;
    @JsonAlias("stock_transfer")
    private String transferId;
    private String deliveryOrder;

    private LocalDateTime actualArrival;
    private LocalDateTime departureTime;
    private GeoPoint arrivalLocation;

    private String skipReason;
    private String skipNotes;
    private boolean unplanned;

    public Stop(int idx, int sequence, StopKind kind, StopStatus status) {
        this.idx = idx;
        this.sequence = sequence;
        this.kind = kind;
        this.status = status;
    }

    /**
     * Identifier of the visit or transfer this stop drives, if any.
     */
    @JsonIgnore
    public String getLinkedUnitId() {
        if (kind == StopKind.TRANSFER) {
            return transferId;
        }
        return visitId;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public boolean isActive() {
        return status != null && status.isActive();
    }
}
