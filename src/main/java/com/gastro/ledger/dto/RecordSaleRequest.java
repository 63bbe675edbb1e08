package com.gastro.ledger.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RecordSaleRequest {

    @NotNull(message = "Product variant ID is required")
    private Long variantId;

    @Min(value = 1, message = "Quantity must be at least 1")
    private int quantity = 1;

    private Long shiftId;
}
