package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.client.FieldBackendClient;
import com.fieldforce.fieldexecutionbackend.dto.ActivityView;
import com.fieldforce.fieldexecutionbackend.dto.VisitBoard;
import com.fieldforce.fieldexecutionbackend.exception.ExecutionValidationException;
import com.fieldforce.fieldexecutionbackend.exception.FieldBackendException;
import com.fieldforce.fieldexecutionbackend.model.Activity;
import com.fieldforce.fieldexecutionbackend.model.ActivityStatus;
import com.fieldforce.fieldexecutionbackend.model.ActivityType;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.Stop;
import com.fieldforce.fieldexecutionbackend.model.UnitKind;
import com.fieldforce.fieldexecutionbackend.model.Visit;
import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;
import com.fieldforce.fieldexecutionbackend.model.result.OpaqueResult;
import com.fieldforce.fieldexecutionbackend.model.result.PhotoResult;
import com.fieldforce.fieldexecutionbackend.store.ProgressStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps the local progress record of each visit or transfer in step with the backend.
 * <p>
 * On activation the local record is merged with the backend's view (backend wins) and written
 * back. Every local change is written through right away and, where the backend cares, submitted
 * to it; a failed submission never rolls the local change back and comes back as a warning.
 * Faults of the local store degrade to working from the backend's view alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationCoordinator {

    static final String SERVER_UNREACHABLE = "Could not reach the server, showing progress saved on this device";
    static final String MEDIA_UNREACHABLE = "Could not load photos from the server";
    static final String STORE_UNAVAILABLE = "Progress could not be saved on this device";

    private final ProgressStore progressStore;
    private final FieldBackendClient backendClient;
    private final ProgressMerger progressMerger;
    private final ActivityCatalog activityCatalog;

    // ---------------------------------------------------------------- visits

    /**
     * Loads, merges and caches the progress of a visit.
     *
     * @param freshCheckIn discard any previous local record first (new check-in)
     */
    public VisitBoard activateVisit(SessionContext session, String visitId, boolean freshCheckIn) {
        return activate(session, visitId, freshCheckIn, true);
    }

    /**
     * @param persist write the merged record back; closed visits are never written
     */
    private VisitBoard activate(SessionContext session, String visitId, boolean freshCheckIn, boolean persist) {
        List<String> warnings = new ArrayList<>();
        ProgressRecord local = null;
        if (freshCheckIn) {
            session.forget(visitId);
            safePurge(visitId);
        } else {
            local = loadLocal(session, visitId, warnings).orElse(null);
        }

        Visit visit = null;
        List<MediaRef> serverMedia = null;
        try {
            visit = backendClient.getVisit(visitId);
        } catch (FieldBackendException e) {
            log.warn("Visit {} fetch failed, continuing from local progress: {}", visitId, e.getMessage());
            warnings.add(SERVER_UNREACHABLE);
        }
        if (visit != null) {
            try {
                serverMedia = backendClient.getVisitMedia(visitId);
            } catch (FieldBackendException e) {
                log.warn("Media fetch for visit {} failed: {}", visitId, e.getMessage());
                warnings.add(MEDIA_UNREACHABLE);
            }
        }

        List<Activity> activities = activityCatalog.activitiesFor(visit);
        ServerProgress server = visit == null ? null : ServerProgress.of(activities, serverMedia);
        Set<String> photoKeys = activities.stream()
                .filter(a -> a.getType() == ActivityType.PHOTO)
                .map(Activity::getKey)
                .collect(Collectors.toSet());
        Set<String> mandatoryKeys = activities.stream()
                .filter(Activity::isMandatory)
                .map(Activity::getKey)
                .collect(Collectors.toSet());

        ProgressRecord merged = progressMerger.merge(visitId, UnitKind.VISIT, local, server, photoKeys, mandatoryKeys);
        session.putWorkingRecord(merged);
        boolean readOnly = isClosed(session, visitId, visit);
        if (persist && !readOnly) {
            safeSave(merged, warnings);
        }
        ActivitySequence sequence = new ActivitySequence(visitId, activities,
                merged.getCompletedActivities(), merged.getSkippedActivities(), readOnly);
        session.putSequence(sequence);

        log.info("Activated visit {} for agent {}: {} activities, {} completed, {} skipped{}",
                visitId, session.getAgentId(), activities.size(), sequence.getCompleted().size(),
                sequence.getSkipped().size(), readOnly ? " (read-only)" : "");
        return board(session, sequence, merged, warnings);
    }

    public VisitBoard visitBoard(SessionContext session, String visitId) {
        Optional<ActivitySequence> cached = session.sequence(visitId);
        if (cached.isEmpty()) {
            return activateVisit(session, visitId, false);
        }
        List<String> warnings = new ArrayList<>();
        return board(session, cached.get(), workingRecord(session, visitId, UnitKind.VISIT, warnings), warnings);
    }

    public ActivitySequence requireSequence(SessionContext session, String visitId) {
        Optional<ActivitySequence> cached = session.sequence(visitId);
        if (cached.isPresent()) {
            return cached.get();
        }
        activateVisit(session, visitId, false);
        return session.sequence(visitId).orElseThrow();
    }

    /**
     * Completes the current activity, or overwrites the result of one completed earlier.
     */
    public VisitBoard completeActivity(SessionContext session, String visitId, String activityKey,
                                       ActivityResult result) {
        ActivitySequence sequence = requireSequence(session, visitId);
        return session.exclusive(visitId, () -> {
            List<String> warnings = new ArrayList<>();
            ProgressRecord record = workingRecord(session, visitId, UnitKind.VISIT, warnings);
            Activity activity = sequence.find(activityKey).orElseThrow(() ->
                    new ExecutionValidationException("Unknown activity " + activityKey + " for visit " + visitId));

            ActivityResult effective = result;
            if (activity.getType() == ActivityType.PHOTO) {
                if (record.getCapturedMedia().isEmpty()) {
                    throw new ExecutionValidationException("Capture at least one photo before completing " + activity.getName());
                }
                if (effective == null) {
                    effective = new PhotoResult(record.getCapturedMedia().stream().map(MediaRef::getId).toList());
                }
            }

            boolean amended = sequence.complete(activityKey);
            record.markCompleted(activityKey);
            record.putResult(activityKey, effective);
            safeSave(record, warnings);
            log.info("{} activity {} on visit {}", amended ? "Amended" : "Completed", activityKey, visitId);

            if (activity.getType().hasRemoteSignificance()
                    && submit(visitId, activity, null, effective, warnings)) {
                record.markConfirmed(activityKey);
                safeSave(record, warnings);
            }
            return board(session, sequence, record, warnings);
        });
    }

    public VisitBoard skipActivity(SessionContext session, String visitId, String activityKey, String reason) {
        ActivitySequence sequence = requireSequence(session, visitId);
        return session.exclusive(visitId, () -> {
            List<String> warnings = new ArrayList<>();
            ProgressRecord record = workingRecord(session, visitId, UnitKind.VISIT, warnings);
            sequence.skip(activityKey);
            Activity activity = sequence.find(activityKey).orElseThrow();

            OpaqueResult skipNote = new OpaqueResult();
            skipNote.put("skipped", true);
            skipNote.put("reason", reason != null && !reason.isBlank() ? reason : "Skipped by user");
            record.markSkipped(activityKey);
            record.putResult(activityKey, skipNote);
            safeSave(record, warnings);
            log.info("Skipped activity {} on visit {}", activityKey, visitId);

            if (activity.getType().hasRemoteSignificance()
                    && submit(visitId, activity, ActivityStatus.SKIPPED.getValue(), skipNote, warnings)) {
                record.markConfirmed(activityKey);
                safeSave(record, warnings);
            }
            return board(session, sequence, record, warnings);
        });
    }

    /**
     * Records a captured photo or signature and attaches it to the visit on the backend.
     */
    public VisitBoard captureMedia(SessionContext session, String visitId, MediaRef media) {
        if (media == null || (media.getId() == null && media.getUrl() == null)) {
            throw new ExecutionValidationException("Captured media needs an id or url");
        }
        ActivitySequence sequence = requireSequence(session, visitId);
        if (sequence.isReadOnly()) {
            throw new ExecutionValidationException("Visit " + visitId + " is closed and can only be viewed");
        }
        return session.exclusive(visitId, () -> {
            List<String> warnings = new ArrayList<>();
            if (media.getId() == null) {
                media.setId(media.getUrl());
            }
            if (media.getCapturedAt() == null) {
                media.setCapturedAt(LocalDateTime.now());
            }
            ProgressRecord record = workingRecord(session, visitId, UnitKind.VISIT, warnings);
            record.addMedia(media);
            safeSave(record, warnings);

            try {
                backendClient.attachVisitMedia(visitId, List.of(media));
            } catch (FieldBackendException e) {
                log.warn("Attaching media {} to visit {} failed: {}", media.getId(), visitId, e.getMessage());
                warnings.add("Photo saved on this device, upload to the server failed: " + e.getMessage());
            }
            return board(session, sequence, record, warnings);
        });
    }

    /**
     * True once anything was completed, skipped or captured for the visit, in the merged view.
     * Reads only; nothing is written to the store.
     */
    public boolean hasProgress(SessionContext session, String visitId) {
        if (session.sequence(visitId).isEmpty()) {
            activate(session, visitId, false, false);
        }
        ActivitySequence sequence = session.sequence(visitId).orElseThrow();
        ProgressRecord record = workingRecord(session, visitId, UnitKind.VISIT, new ArrayList<>());
        return sequence.hasProgress() || record.hasProgress();
    }

    // ---------------------------------------------------------------- transfers

    public void openTransfer(SessionContext session, String transferId) {
        session.forget(transferId);
        ProgressRecord record = new ProgressRecord(transferId, UnitKind.TRANSFER);
        session.putWorkingRecord(record);
        safeSave(record, new ArrayList<>());
    }

    /**
     * Records which products of a transfer are fully accounted for, as last reported by the
     * backend.
     */
    public void trackLoadedItems(SessionContext session, String transferId, Collection<String> accountedProducts) {
        List<String> warnings = new ArrayList<>();
        ProgressRecord record = workingRecord(session, transferId, UnitKind.TRANSFER, warnings);
        record.getCompletedActivities().retainAll(accountedProducts);
        accountedProducts.forEach(record::markCompleted);
        record.touch();
        safeSave(record, warnings);
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Drops the local record after a terminal transition.
     */
    public void purge(SessionContext session, String unitId) {
        session.forget(unitId);
        safePurge(unitId);
    }

    // ---------------------------------------------------------------- internals

    private boolean submit(String visitId, Activity activity, String status, ActivityResult result,
                           List<String> warnings) {
        try {
            backendClient.markActivityCompleted(visitId, activity.getType().getBackendLabel(),
                    activity.getName(), status, result);
            return true;
        } catch (FieldBackendException e) {
            log.warn("Syncing activity {} of visit {} failed, kept locally: {}",
                    activity.getKey(), visitId, e.getMessage());
            warnings.add(activity.getName() + " saved on this device, server sync failed: " + e.getMessage());
            return false;
        }
    }

    private VisitBoard board(SessionContext session, ActivitySequence sequence, ProgressRecord record,
                             List<String> warnings) {
        VisitBoard board = new VisitBoard();
        board.setVisitId(sequence.getVisitId());
        findStop(session, sequence.getVisitId()).ifPresent(stop -> board.setStopIdx(stop.getIdx()));
        board.setReadOnly(sequence.isReadOnly());
        sequence.current().ifPresent(a -> board.setCurrentActivity(a.getKey()));

        for (Activity activity : sequence.getActivities()) {
            boolean done = activity.getStatus() != ActivityStatus.PENDING;
            ActivityResult result = record.getActivityResults().get(activity.getKey());
            board.getActivities().add(new ActivityView(
                    activity.getKey(),
                    activity.getType(),
                    activity.getName(),
                    activity.getSequence(),
                    activity.isMandatory(),
                    activity.getStatus(),
                    sequence.accessOf(activity.getKey()),
                    done && !record.getConfirmedActivities().contains(activity.getKey()),
                    result != null ? result : activity.getResult()));
        }
        board.getMedia().addAll(record.getCapturedMedia());
        sequence.pendingMandatory().forEach(a -> board.getPendingMandatory().add(a.getName()));

        boolean progress = sequence.hasProgress() || record.hasProgress();
        board.setCanFinalize(!sequence.isReadOnly() && board.getPendingMandatory().isEmpty());
        board.setCanSkipVisit(!sequence.isReadOnly() && !progress);
        board.getWarnings().addAll(warnings);
        return board;
    }

    private boolean isClosed(SessionContext session, String visitId, Visit visit) {
        if (visit != null && visit.getStatus() != null && visit.getStatus().isTerminal()) {
            return true;
        }
        return findStop(session, visitId).map(Stop::isTerminal).orElse(false);
    }

    private Optional<Stop> findStop(SessionContext session, String unitId) {
        Route route = session.getRoute();
        if (route == null || route.getStops() == null) {
            return Optional.empty();
        }
        return route.getStops().stream()
                .filter(s -> unitId.equals(s.getLinkedUnitId()))
                .findFirst();
    }

    private ProgressRecord workingRecord(SessionContext session, String unitId, UnitKind kind, List<String> warnings) {
        Optional<ProgressRecord> cached = session.workingRecord(unitId);
        if (cached.isPresent()) {
            return cached.get();
        }
        ProgressRecord record = loadLocal(session, unitId, warnings).orElseGet(() -> new ProgressRecord(unitId, kind));
        session.putWorkingRecord(record);
        return record;
    }

    private Optional<ProgressRecord> loadLocal(SessionContext session, String unitId, List<String> warnings) {
        try {
            Optional<ProgressRecord> stored = progressStore.load(unitId);
            if (stored.isPresent()) {
                return stored;
            }
        } catch (DataAccessException e) {
            log.warn("Progress store read failed for {}: {}", unitId, e.getMessage());
            warnings.add(STORE_UNAVAILABLE);
        }
        return session.workingRecord(unitId);
    }

    private void safeSave(ProgressRecord record, List<String> warnings) {
        try {
            progressStore.save(record);
        } catch (DataAccessException e) {
            log.warn("Progress store write failed for {}: {}", record.getUnitId(), e.getMessage());
            if (!warnings.contains(STORE_UNAVAILABLE)) {
                warnings.add(STORE_UNAVAILABLE);
            }
        }
    }

    private void safePurge(String unitId) {
        try {
            progressStore.purge(unitId);
        } catch (DataAccessException e) {
            log.warn("Progress store purge failed for {}: {}", unitId, e.getMessage());
        }
    }
}
