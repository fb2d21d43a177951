package com.fieldforce.fieldexecutionbackend.dto;

import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the device shows for a visit: activities with their access, captured media, and
 * whether the visit can be finalized or skipped right now.
 */
@Data
@NoArgsConstructor
public class VisitBoard {
    private String visitId;
    private Integer stopIdx;
    private boolean readOnly;
    private String currentActivity;
    private List<ActivityView> activities = new ArrayList<>();
    private List<MediaRef> media = new ArrayList<>();
    private List<String> pendingMandatory = new ArrayList<>();
    private boolean canFinalize;
    private boolean canSkipVisit;
    // Non-blocking problems, e.g. a sync that failed while local state was kept
    private List<String> warnings = new ArrayList<>();
}
