package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
public class TransferItemCheck {
    private String productCode;
    private String productName;
    private String uom;
    private String deliveryOrder;

    private double expectedQty;
    private double loadedQty;
    private double receivedQty;

    private double verifiedQty;
    private double damagedQty;
    private double missingQty;
    private ItemCheckStatus checkStatus = ItemCheckStatus.PENDING;

    public TransferItemCheck(String productCode, double expectedQty, ItemCheckStatus checkStatus) {
        this.productCode = productCode;
        this.expectedQty = expectedQty;
        this.checkStatus = checkStatus;
    }

    @JsonIgnore
    public double getAccountedQty() {
        return verifiedQty + damagedQty + missingQty;
    }
}
