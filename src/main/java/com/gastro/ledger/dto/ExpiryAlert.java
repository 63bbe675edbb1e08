package com.gastro.ledger.dto;

import com.gastro.ledger.model.AlertLevel;
import com.gastro.ledger.model.StockLocation;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExpiryAlert(
        Long batchId,
        String batchNumber,
        Long ingredientId,
        String ingredientName,
        String unitLabel,
        StockLocation location,
        LocalDate expiryDate,
        BigDecimal remainingQuantity,
        long daysUntilExpiry,
        AlertLevel alertLevel) {
}
