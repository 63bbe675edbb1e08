package com.gastro.ledger.dto;

import com.gastro.ledger.model.StockLocation;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class TransferRequest {

    @NotNull(message = "Ingredient ID is required")
    private Long ingredientId;

    @NotNull(message = "Quantity is required")
    private BigDecimal quantity;

    private StockLocation from = StockLocation.STORAGE;

    private StockLocation to = StockLocation.SHOP;
}
