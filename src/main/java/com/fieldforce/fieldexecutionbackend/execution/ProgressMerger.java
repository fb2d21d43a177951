package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import com.fieldforce.fieldexecutionbackend.model.UnitKind;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Merges the local progress record with what the backend confirmed. The backend wins every
 * conflict; local facts it does not contradict stay in as provisional.
 */
@Component
public class ProgressMerger {

    /**
     * @param local     local record, may be {@code null}
     * @param server    backend view, {@code null} when it could not be fetched
     * @param photoKeys activities satisfied by the presence of media on the backend
     * @param mandatoryKeys activities that may never be recorded as skipped
     */
    public ProgressRecord merge(String unitId, UnitKind kind, ProgressRecord local,
                                ServerProgress server, Set<String> photoKeys, Set<String> mandatoryKeys) {
        ProgressRecord merged = combine(unitId, kind, local, server, photoKeys);
        if (mandatoryKeys != null) {
            merged.getSkippedActivities().removeAll(mandatoryKeys);
        }
        return merged;
    }

    private ProgressRecord combine(String unitId, UnitKind kind, ProgressRecord local,
                                   ServerProgress server, Set<String> photoKeys) {
        ProgressRecord merged = new ProgressRecord(unitId, kind);
        if (local != null) {
            merged.setCreatedAt(local.getCreatedAt());
            merged.getCompletedActivities().addAll(local.getCompletedActivities());
            merged.getSkippedActivities().addAll(local.getSkippedActivities());
            merged.getConfirmedActivities().addAll(local.getConfirmedActivities());
            merged.getActivityResults().putAll(local.getActivityResults());
        }
        if (server == null) {
            if (local != null) {
                merged.getCapturedMedia().addAll(local.getCapturedMedia());
            }
            return merged;
        }

        for (String key : server.getCompleted()) {
            merged.getSkippedActivities().remove(key);
            merged.getCompletedActivities().add(key);
            merged.getConfirmedActivities().add(key);
        }
        for (String key : server.getSkipped()) {
            merged.getCompletedActivities().remove(key);
            merged.getSkippedActivities().add(key);
            merged.getConfirmedActivities().add(key);
        }

        if (server.getMedia() != null) {
            Set<String> serverIds = new HashSet<>();
            for (MediaRef media : server.getMedia()) {
                merged.getCapturedMedia().add(media);
                serverIds.add(media.getId());
            }
            if (local != null) {
                for (MediaRef media : local.getCapturedMedia()) {
                    if (!serverIds.contains(media.getId())) {
                        merged.getCapturedMedia().add(media);
                    }
                }
            }
            if (!server.getMedia().isEmpty() && photoKeys != null) {
                for (String key : photoKeys) {
                    merged.getSkippedActivities().remove(key);
                    merged.getCompletedActivities().add(key);
                    merged.getConfirmedActivities().add(key);
                }
            }
        } else if (local != null) {
            merged.getCapturedMedia().addAll(local.getCapturedMedia());
        }
        return merged;
    }
}
