package com.gastro.ledger.dto;

import com.gastro.ledger.model.AlertLevel;
import com.gastro.ledger.model.StockLocation;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BatchStockLine(
        Long batchId,
        String batchNumber,
        StockLocation location,
        LocalDate expiryDate,
        BigDecimal remainingQuantity,
        int fifoOrder,
        Long daysUntilExpiry,
        AlertLevel alertLevel) {
}
