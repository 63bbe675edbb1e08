package com.gastro.ledger.dto;

import com.gastro.ledger.model.DayStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * Recorded against inventory-implied revenue for one day. Built on request
 * from committed state and never stored.
 */
public record ReconciliationReport(
        Long dailyRecordId,
        DayStatus dayStatus,
        String currency,
        BigDecimal recordedTotal,
        BigDecimal calculatedTotal,
        BigDecimal discrepancy,
        BigDecimal discrepancyPercent,
        boolean hasCriticalDiscrepancy,
        boolean hasNoRecordedSales,
        List<ProductReconciliation> byProduct,
        List<MissingSaleSuggestion> suggestions,
        List<SharedPrimaryIngredient> excludedIngredients) {
}
