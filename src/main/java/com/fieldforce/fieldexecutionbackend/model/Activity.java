package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One gated sub-task of a visit. {@code key} is the stable identifier used by the
 * progress record (e.g. {@code photos}, {@code stock_opname}).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
public class Activity {
    private String key;
    @JsonAlias("activity_type")
    private ActivityType type;
    @JsonAlias("activity_name")
    private String name;
    private int sequence;
    private boolean mandatory;
    private ActivityStatus status = ActivityStatus.PENDING;
    private ActivityResult result;
    private LocalDateTime completedAt;

    public Activity(String key, ActivityType type, String name, int sequence, boolean mandatory) {
        this.key = key;
        this.type = type;
        this.name = name;
        this.sequence = sequence;
        this.mandatory = mandatory;
    }

    public Activity copy() {
        return new Activity(key, type, name, sequence, mandatory, status, result, completedAt);
    }
}
