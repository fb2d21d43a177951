package com.fieldforce.fieldexecutionbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckInResult {
    private RouteBoard route;
    // null for stops without a visit
    private VisitBoard visit;
}
