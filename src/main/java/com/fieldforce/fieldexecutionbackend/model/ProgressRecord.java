package com.fieldforce.fieldexecutionbackend.model;

import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Device-local, restart-durable snapshot of an in-progress visit or transfer.
 * One record per unit identifier, never shared.
 */
@Data
@NoArgsConstructor
@Document(collection = "progress_records")
public class ProgressRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String unitId;
    private UnitKind unitKind;

    private Set<String> completedActivities = new LinkedHashSet<>();
    private Set<String> skippedActivities = new LinkedHashSet<>();
    // Activities the backend has acknowledged; the rest are provisional
    private Set<String> confirmedActivities = new LinkedHashSet<>();
    private List<MediaRef> capturedMedia = new ArrayList<>();
    private Map<String, ActivityResult> activityResults = new LinkedHashMap<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public ProgressRecord(String unitId, UnitKind unitKind) {
        this.unitId = unitId;
        this.unitKind = unitKind;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * True once anything was completed, skipped or captured. Abandoning the unit after that
     * point would discard field work.
     */
    public boolean hasProgress() {
        return !completedActivities.isEmpty()
                || !skippedActivities.isEmpty()
                || !capturedMedia.isEmpty();
    }

    public void markCompleted(String activityKey) {
        skippedActivities.remove(activityKey);
        completedActivities.add(activityKey);
        touch();
    }

    public void markSkipped(String activityKey) {
        completedActivities.remove(activityKey);
        skippedActivities.add(activityKey);
        touch();
    }

    public void markConfirmed(String activityKey) {
        confirmedActivities.add(activityKey);
        touch();
    }

    public void addMedia(MediaRef media) {
        boolean known = capturedMedia.stream()
                .anyMatch(m -> m.getId() != null && m.getId().equals(media.getId()));
        if (!known) {
            capturedMedia.add(media);
        }
        touch();
    }

    public void putResult(String activityKey, ActivityResult result) {
        if (result != null) {
            activityResults.put(activityKey, result);
        }
        touch();
    }

    public void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
