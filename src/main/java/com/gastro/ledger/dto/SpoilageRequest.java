package com.gastro.ledger.dto;

import com.gastro.ledger.model.SpoilageReason;
import com.gastro.ledger.model.StockLocation;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class SpoilageRequest {

    @NotNull(message = "Ingredient ID is required")
    private Long ingredientId;

    @NotNull(message = "Quantity is required")
    private BigDecimal quantity;

    @NotNull(message = "Spoilage reason is required")
    private SpoilageReason reason;

    private StockLocation location = StockLocation.SHOP;

    private String notes;
}
