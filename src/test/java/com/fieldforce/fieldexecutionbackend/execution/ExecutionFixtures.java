package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties;
import com.fieldforce.fieldexecutionbackend.model.Activity;
import com.fieldforce.fieldexecutionbackend.model.ActivityType;
import com.fieldforce.fieldexecutionbackend.model.ItemCheckStatus;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.RouteStatus;
import com.fieldforce.fieldexecutionbackend.model.Stop;
import com.fieldforce.fieldexecutionbackend.model.StopKind;
import com.fieldforce.fieldexecutionbackend.model.StopStatus;
import com.fieldforce.fieldexecutionbackend.model.Transfer;
import com.fieldforce.fieldexecutionbackend.model.TransferItemCheck;
import com.fieldforce.fieldexecutionbackend.model.TransferStatus;
import com.fieldforce.fieldexecutionbackend.model.Visit;
import com.fieldforce.fieldexecutionbackend.model.VisitStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for engine tests.
 */
public final class ExecutionFixtures {

    public static final String ROUTE_ID = "ROUTE-2024-0001";
    public static final String AGENT_ID = "agent-7";

    private ExecutionFixtures() {
    }

    /**
     * photo M, stock check M, payment O, order O, survey O
     */
    public static List<Activity> standardActivities() {
        List<Activity> activities = new ArrayList<>();
        activities.add(new Activity("photos", ActivityType.PHOTO, "Take Photo", 1, true));
        activities.add(new Activity("stock_opname", ActivityType.STOCK_CHECK, "Stock Opname", 2, true));
        activities.add(new Activity("payment", ActivityType.PAYMENT, "Payment Collection", 3, false));
        activities.add(new Activity("sales_order", ActivityType.ORDER, "Sales Order", 4, false));
        activities.add(new Activity("competitor_survey", ActivityType.SURVEY, "Competitor Survey", 5, false));
        return activities;
    }

    public static Stop visitStop(int idx, StopStatus status) {
        Stop stop = new Stop(idx, idx, StopKind.VISIT, status);
        stop.setVisitId("VISIT-" + idx);
        stop.setCustomer("CUST-" + idx);
        stop.setCustomerName("Customer " + idx);
        return stop;
    }

    public static Route route(RouteStatus status, Stop... stops) {
        Route route = new Route();
        route.setId(ROUTE_ID);
        route.setAssignedAgent(AGENT_ID);
        route.setStatus(status);
        route.setStops(new ArrayList<>(List.of(stops)));
        route.setTotalStops(stops.length);
        return route;
    }

    public static Visit visit(String visitId, VisitStatus status, List<Activity> activities) {
        Visit visit = new Visit();
        visit.setId(visitId);
        visit.setRouteId(ROUTE_ID);
        visit.setStatus(status);
        visit.setActivities(activities);
        return visit;
    }

    public static Transfer transfer(String transferId, TransferStatus status, ItemCheckStatus... itemStatuses) {
        Transfer transfer = new Transfer();
        transfer.setId(transferId);
        transfer.setStatus(status);
        transfer.setSourceWarehouse("WH-Central");
        transfer.setDestWarehouse("DC-North");
        List<TransferItemCheck> items = new ArrayList<>();
        for (int i = 0; i < itemStatuses.length; i++) {
            TransferItemCheck item = new TransferItemCheck("SKU-" + (i + 1), 10, itemStatuses[i]);
            item.setProductName("Product " + (i + 1));
            items.add(item);
        }
        transfer.setItems(items);
        return transfer;
    }

    public static FieldExecutionProperties properties() {
        return new FieldExecutionProperties();
    }
}
