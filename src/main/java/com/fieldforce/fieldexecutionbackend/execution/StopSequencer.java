package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.client.FieldBackendClient;
import com.fieldforce.fieldexecutionbackend.dto.CheckInResult;
import com.fieldforce.fieldexecutionbackend.dto.RouteBoard;
import com.fieldforce.fieldexecutionbackend.dto.StopView;
import com.fieldforce.fieldexecutionbackend.dto.UnplannedStopRequest;
import com.fieldforce.fieldexecutionbackend.dto.VisitBoard;
import com.fieldforce.fieldexecutionbackend.exception.ExecutionValidationException;
import com.fieldforce.fieldexecutionbackend.exception.FieldBackendException;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.RouteStatus;
import com.fieldforce.fieldexecutionbackend.model.Stop;
import com.fieldforce.fieldexecutionbackend.model.StopKind;
import com.fieldforce.fieldexecutionbackend.model.StopStatus;
import com.fieldforce.fieldexecutionbackend.service.RouteUpdatePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which stop of the route is active, which may be checked into and which are locked,
 * and drives the route-level transitions. The route is always the one last returned by the
 * backend; it is re-fetched or replaced after every mutating call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StopSequencer {

    private final FieldBackendClient backendClient;
    private final ReconciliationCoordinator reconciliationCoordinator;
    private final LocationCapture locationCapture;
    private final RouteUpdatePublisher routeUpdatePublisher;

    // ---------------------------------------------------------------- reads

    public Optional<RouteBoard> loadTodaysRoute(SessionContext session) {
        Optional<Route> route = backendClient.getTodaysRoute(session.getAgentId());
        session.setRoute(route.orElse(null));
        return route.map(this::board);
    }

    /**
     * Re-fetches the session's route from the backend and publishes the recomputed board.
     */
    public RouteBoard refresh(SessionContext session) {
        Route current = requireRoute(session);
        Route fresh = backendClient.getRoute(current.getId());
        session.setRoute(fresh);
        return publish(fresh);
    }

    /**
     * Like {@link #refresh}, but a failed fetch only logs and returns the board of the route
     * already held.
     */
    public RouteBoard refreshQuietly(SessionContext session) {
        try {
            return refresh(session);
        } catch (FieldBackendException e) {
            log.warn("Route refresh for agent {} failed, keeping last known route: {}",
                    session.getAgentId(), e.getMessage());
            return session.currentRoute().map(this::board).orElse(null);
        }
    }

    public RouteBoard currentBoard(SessionContext session) {
        return board(requireRoute(session));
    }

    public Map<Integer, StopAccess> computeAccess(Route route) {
        Map<Integer, StopAccess> access = new LinkedHashMap<>();
        List<Stop> ordered = route.getOrderedStops();
        if (route.getStatus() != RouteStatus.IN_PROGRESS) {
            ordered.forEach(s -> access.put(s.getIdx(), StopAccess.LOCKED));
            return access;
        }

        Optional<Stop> active = activeStop(route);
        for (Stop stop : ordered) {
            if (stop.isTerminal()) {
                access.put(stop.getIdx(), StopAccess.READ_ONLY);
            } else if (active.isPresent()) {
                access.put(stop.getIdx(), stop.getIdx() == active.get().getIdx() ? StopAccess.ACTIVE : StopAccess.LOCKED);
            } else {
                access.put(stop.getIdx(), StopAccess.ELIGIBLE);
            }
        }
        return access;
    }

    /**
     * The stop currently arrived at or in progress. If the backend reports more than one, the
     * lowest sequence wins.
     */
    public Optional<Stop> activeStop(Route route) {
        List<Stop> active = route.getOrderedStops().stream()
                .filter(Stop::isActive)
                .toList();
        if (active.size() > 1) {
            log.warn("Route {} reports {} active stops (idx {}), treating sequence {} as active",
                    route.getId(), active.size(),
                    active.stream().map(Stop::getIdx).toList(), active.get(0).getSequence());
        }
        return active.stream().min(Comparator.comparingInt(Stop::getSequence));
    }

    public RouteBoard board(Route route) {
        Map<Integer, StopAccess> access = computeAccess(route);
        RouteBoard board = new RouteBoard();
        board.setRouteId(route.getId());
        board.setRouteDate(route.getRouteDate());
        board.setStatus(route.getStatus());
        board.setTotalStops(route.getStops() == null ? 0 : route.getStops().size());
        board.setCompletedStops(count(route, StopStatus.COMPLETED));
        board.setSkippedStops(count(route, StopStatus.SKIPPED));
        board.setProgressPercentage(route.getProgressPercentage());

        Optional<Stop> active = route.getStatus() == RouteStatus.IN_PROGRESS ? activeStop(route) : Optional.empty();
        active.ifPresent(stop -> board.setActiveStopIdx(stop.getIdx()));
        board.setCanStart(route.getStatus() == RouteStatus.NOT_STARTED);
        board.setCanEnd(route.getStatus() == RouteStatus.IN_PROGRESS && active.isEmpty());

        for (Stop stop : route.getOrderedStops()) {
            board.getStops().add(new StopView(stop, access.get(stop.getIdx())));
        }
        return board;
    }

    // ---------------------------------------------------------------- route transitions

    public RouteBoard startRoute(SessionContext session, Double latitude, Double longitude) {
        Route route = requireRoute(session);
        if (route.getStatus() != RouteStatus.NOT_STARTED) {
            throw new ExecutionValidationException("Route " + route.getId() + " is " + route.getStatus().getValue()
                    + " and cannot be started");
        }
        return session.exclusive(route.getId(), () -> {
            GeoPoint location = locationCapture.resolve(session, latitude, longitude);
            Route updated = backendClient.startRoute(route.getId(), location);
            session.setRoute(updated);
            log.info("Route {} started by agent {} at {}", route.getId(), session.getAgentId(), location);
            return publish(updated);
        });
    }

    public RouteBoard endRoute(SessionContext session, Double latitude, Double longitude, String notes) {
        Route route = requireRoute(session);
        if (route.getStatus() != RouteStatus.IN_PROGRESS) {
            throw new ExecutionValidationException("Route " + route.getId() + " is not in progress");
        }
        activeStop(route).ifPresent(stop -> {
            throw new ExecutionValidationException("Finish or skip " + describe(stop) + " before ending the route");
        });
        return session.exclusive(route.getId(), () -> {
            GeoPoint location = locationCapture.resolve(session, latitude, longitude);
            Route updated = backendClient.endRoute(route.getId(), location, notes);
            session.setRoute(updated);
            log.info("Route {} ended by agent {}", route.getId(), session.getAgentId());
            return publish(updated);
        });
    }

    /**
     * Checks into an eligible stop. Any earlier local progress of the linked visit or transfer is
     * discarded and a visit starts from a freshly merged record.
     */
    public CheckInResult checkIn(SessionContext session, int stopIdx, Double latitude, Double longitude) {
        Route route = requireRoute(session);
        Stop stop = route.findStop(stopIdx).orElseThrow(() ->
                new ExecutionValidationException("Route " + route.getId() + " has no stop " + stopIdx));
        StopAccess access = computeAccess(route).get(stopIdx);
        if (access != StopAccess.ELIGIBLE) {
            throw new ExecutionValidationException(describe(stop) + " cannot be checked into ("
                    + access.name().toLowerCase(Locale.ROOT) + ")");
        }

        return session.exclusive(route.getId(), () -> {
            GeoPoint location = locationCapture.resolve(session, latitude, longitude);
            if (!location.isKnown()) {
                log.warn("Checking into {} of route {} without a location fix", describe(stop), route.getId());
            }
            Route updated = backendClient.arriveAtStop(route.getId(), stopIdx, location);
            session.setRoute(updated);
            log.info("Agent {} checked into {} of route {}", session.getAgentId(), describe(stop), route.getId());

            Stop arrived = updated.findStop(stopIdx).orElse(stop);
            VisitBoard visit = null;
            String unitId = arrived.getLinkedUnitId();
            if (unitId != null) {
                if (arrived.getKind() == StopKind.TRANSFER) {
                    reconciliationCoordinator.purge(session, unitId);
                } else {
                    visit = reconciliationCoordinator.activateVisit(session, unitId, true);
                }
            }
            return new CheckInResult(publish(updated), visit);
        });
    }

    public CheckInResult addUnplannedStop(SessionContext session, UnplannedStopRequest request) {
        Route route = requireRoute(session);
        if (route.getStatus() == RouteStatus.COMPLETED || route.getStatus() == RouteStatus.CANCELLED) {
            throw new ExecutionValidationException("Route " + route.getId() + " is closed");
        }
        if (request.getKind() == null) {
            request.setKind(StopKind.VISIT);
        }
        if (request.getKind() == StopKind.VISIT && isBlank(request.getCustomer())) {
            throw new ExecutionValidationException("An unplanned visit needs a customer");
        }
        if (request.isCheckInNow()) {
            if (route.getStatus() != RouteStatus.IN_PROGRESS) {
                throw new ExecutionValidationException("Start the route before checking into a stop");
            }
            activeStop(route).ifPresent(stop -> {
                throw new ExecutionValidationException("Finish or skip " + describe(stop) + " before checking in elsewhere");
            });
        }

        Route updated = session.exclusive(route.getId(), () -> backendClient.addUnplannedStop(route.getId(), request));
        session.setRoute(updated);
        Stop added = updated.getOrderedStops().stream()
                .reduce((first, second) -> second)
                .orElseThrow(() -> new ExecutionValidationException("Backend returned a route without stops"));
        log.info("Unplanned stop {} appended to route {}", added.getIdx(), route.getId());

        if (request.isCheckInNow()) {
            return checkIn(session, added.getIdx(), request.getLatitude(), request.getLongitude());
        }
        return new CheckInResult(publish(updated), null);
    }

    // ---------------------------------------------------------------- helpers

    public Route requireRoute(SessionContext session) {
        return session.currentRoute().orElseThrow(() ->
                new ExecutionValidationException("No route loaded for agent " + session.getAgentId()));
    }

    public Optional<Stop> stopForUnit(SessionContext session, String unitId) {
        return session.currentRoute()
                .flatMap(route -> route.getOrderedStops().stream()
                        .filter(s -> unitId.equals(s.getLinkedUnitId()))
                        .findFirst());
    }

    private RouteBoard publish(Route route) {
        RouteBoard board = board(route);
        routeUpdatePublisher.publishRouteBoard(board);
        return board;
    }

    private int count(Route route, StopStatus status) {
        if (route.getStops() == null) {
            return 0;
        }
        return (int) route.getStops().stream().filter(s -> s.getStatus() == status).count();
    }

    private String describe(Stop stop) {
        String name = stop.getStopName() != null ? stop.getStopName() : stop.getCustomerName();
        return "stop " + stop.getSequence() + (name != null ? " (" + name + ")" : "");
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
