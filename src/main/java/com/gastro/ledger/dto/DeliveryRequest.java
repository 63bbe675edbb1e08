package com.gastro.ledger.dto;

import com.gastro.ledger.model.StockLocation;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class DeliveryRequest {

    @NotNull(message = "Ingredient ID is required")
    private Long ingredientId;

    @NotNull(message = "Quantity is required")
    private BigDecimal quantity;

    private StockLocation destination = StockLocation.STORAGE;

    private LocalDate expiryDate;

    private String notes;
}
