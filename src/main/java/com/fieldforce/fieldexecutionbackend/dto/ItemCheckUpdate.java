package com.fieldforce.fieldexecutionbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemCheckUpdate {
    private String productCode;
    private double verifiedQty;
    private double damagedQty;
    private double missingQty;
    private boolean rejected;
}
