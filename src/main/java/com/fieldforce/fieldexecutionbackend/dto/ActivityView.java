package com.fieldforce.fieldexecutionbackend.dto;

import com.fieldforce.fieldexecutionbackend.execution.ActivityAccess;
import com.fieldforce.fieldexecutionbackend.model.ActivityStatus;
import com.fieldforce.fieldexecutionbackend.model.ActivityType;
import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityView {
    private String key;
    private ActivityType type;
    private String name;
    private int sequence;
    private boolean mandatory;
    private ActivityStatus status;
    private ActivityAccess access;
    // Recorded on this device but not acknowledged by the backend yet
    private boolean provisional;
    private ActivityResult result;
}
