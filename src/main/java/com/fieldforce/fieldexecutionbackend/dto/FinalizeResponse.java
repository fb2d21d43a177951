package com.fieldforce.fieldexecutionbackend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Answer of the backend's visit completion call. A non-empty {@code syncWarnings} list means the
 * visit was NOT completed downstream and must be retried.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinalizeResponse {
    private String visitId;
    private String status;
    private Double complianceScore;
    private List<String> syncWarnings = new ArrayList<>();

    @JsonIgnore
    public boolean hasWarnings() {
        return syncWarnings != null && !syncWarnings.isEmpty();
    }
}
