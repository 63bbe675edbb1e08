package com.gastro.ledger.dto;

import com.gastro.ledger.model.IngredientBatch;
import com.gastro.ledger.model.StockLocation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record BatchResponse(
        Long id,
        String batchNumber,
        Long ingredientId,
        String ingredientName,
        String unitLabel,
        StockLocation location,
        LocalDate expiryDate,
        BigDecimal initialQuantity,
        BigDecimal remainingQuantity,
        boolean active,
        LocalDateTime createdAt) {

    public static BatchResponse from(IngredientBatch batch) {
        return new BatchResponse(
                batch.getId(),
                batch.getBatchNumber(),
                batch.getIngredient().getId(),
                batch.getIngredient().getName(),
                batch.getIngredient().getUnitLabel(),
                batch.getLocation(),
                batch.getExpiryDate(),
                batch.getInitialQuantity(),
                batch.getRemainingQuantity(),
                batch.isActive(),
                batch.getCreatedAt());
    }
}
