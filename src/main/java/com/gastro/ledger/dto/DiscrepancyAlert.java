package com.gastro.ledger.dto;

import com.gastro.ledger.model.DiscrepancySeverity;

import java.math.BigDecimal;

public record DiscrepancyAlert(
        Long ingredientId,
        String ingredientName,
        BigDecimal discrepancyPercent,
        DiscrepancySeverity severity,
        String message) {
}
