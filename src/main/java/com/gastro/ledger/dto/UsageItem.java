package com.gastro.ledger.dto;

import com.gastro.ledger.model.DiscrepancySeverity;
import com.gastro.ledger.model.UnitType;

import java.math.BigDecimal;

/**
 * Closing arithmetic for one ingredient:
 * {@code usage = opening + deliveriesIn + transfersIn - transfersOut - spoilageOut - closing}.
 * {@code discrepancyPercent} is null when there is no expected usage to compare with.
 */
public record UsageItem(
        Long ingredientId,
        String ingredientName,
        UnitType unitType,
        String unitLabel,
        BigDecimal opening,
        BigDecimal deliveriesIn,
        BigDecimal transfersIn,
        BigDecimal transfersOut,
        BigDecimal spoilageOut,
        BigDecimal expectedClosing,
        BigDecimal closing,
        BigDecimal usage,
        BigDecimal expectedUsage,
        BigDecimal discrepancyPercent,
        DiscrepancySeverity severity) {
}
