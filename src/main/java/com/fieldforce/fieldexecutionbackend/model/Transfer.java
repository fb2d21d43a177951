package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Goods movement between two warehouses, as last fetched from the field backend.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Transfer {
    @JsonAlias("name")
    private String id;
    private TransferType type;
    private TransferStatus status = TransferStatus.PENDING;
    private LocalDate scheduledDate;

    private String sourceWarehouse;
    private String destWarehouse;
    private String assignedDriver;
    private String routeId;
    private Integer routeStopIdx;

    private List<TransferItemCheck> items = new ArrayList<>();
    private List<String> linkedDeliveries = new ArrayList<>();

    private String receivedBy;
    private LocalDateTime receivedAt;
    private String handoffPhoto;
    private String handoffNotes;
    private String returnReason;

    private LocalDateTime loadingCompletedAt;
    private LocalDateTime transitStartedAt;
    private LocalDateTime arrivedAt;

    /**
     * Items whose check has not reached a terminal status yet.
     */
    @JsonIgnore
    public List<TransferItemCheck> getUnaccountedItems() {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .filter(i -> i.getCheckStatus() == null || !i.getCheckStatus().isTerminal())
                .toList();
    }

    public int getLoadingProgressPercentage() {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        int accounted = items.size() - getUnaccountedItems().size();
        return (int) Math.round(accounted * 100.0 / items.size());
    }
}
