package com.fieldforce.fieldexecutionbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Handoff at the destination warehouse. The photo is optional and, when present, is uploaded
 * before the status call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HandoffRequest {
    private String receivedBy;
    private String photoBase64;
    private String photoFileName;
    private String notes;
}
