package com.gastro.ledger.dto;

import java.math.BigDecimal;

/**
 * One variant's line in the reconciliation report. Calculated figures are
 * zero for variants that cannot be attributed from ingredient usage.
 */
public record ProductReconciliation(
        Long variantId,
        String productName,
        BigDecimal price,
        boolean attributable,
        BigDecimal recordedQty,
        BigDecimal recordedRevenue,
        BigDecimal calculatedQty,
        BigDecimal calculatedRevenue,
        BigDecimal qtyDifference,
        BigDecimal revenueDifference) {
}
