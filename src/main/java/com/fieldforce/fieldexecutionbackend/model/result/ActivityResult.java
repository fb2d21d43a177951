package com.fieldforce.fieldexecutionbackend.model.result;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Captured outcome of one visit activity, discriminated by {@code kind}.
 * Unknown kinds fall back to {@link OpaqueResult} so newer backends do not break older devices.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = OpaqueResult.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = PhotoResult.class, name = "photo"),
        @JsonSubTypes.Type(value = StockCountResult.class, name = "stock_count"),
        @JsonSubTypes.Type(value = PaymentResult.class, name = "payment"),
        @JsonSubTypes.Type(value = OrderResult.class, name = "order"),
        @JsonSubTypes.Type(value = SurveyResult.class, name = "survey"),
        @JsonSubTypes.Type(value = OpaqueResult.class, name = "opaque")
})
public abstract class ActivityResult {
}
