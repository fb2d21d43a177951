package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Opaque reference to a captured photo or signature. The capture widget owns the bytes.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
public class MediaRef {
    private String id;
    private String url;
    private String fileName;
    private LocalDateTime capturedAt;
}
